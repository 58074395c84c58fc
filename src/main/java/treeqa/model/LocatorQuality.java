package treeqa.model;

/** Stability of a recorded locator, derived from its {@link Locator.Kind}. */
public enum LocatorQuality {
    /** Stable id. */
    HIGH,
    /** Display name. */
    MEDIUM,
    /** Structural path or coordinate sentinel. */
    LOW
}

package treeqa.model;

import java.util.Objects;

/**
 * A resolved locator: the string a replay finder looks up, the strategy that
 * produced it, and an optional diagnostic explaining a fallback.
 *
 * <p>Stable-id locators never carry a diagnostic.
 */
public record Locator(String value, Kind kind, String diagnostic) {

    public enum Kind { STABLE_ID, DISPLAY_NAME, STRUCTURAL_PATH, COORDINATE }

    public static final String DISPLAY_NAME_DIAGNOSTIC    = "fallback: display name";
    public static final String STRUCTURAL_PATH_DIAGNOSTIC = "fallback: structural path — high risk of breakage";

    /** Locator of steps that are not scoped to a control (key presses). */
    public static final Locator NONE = new Locator("", Kind.STABLE_ID, null);

    public Locator {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.STABLE_ID && diagnostic != null) {
            throw new IllegalArgumentException("stable-id locator must not carry a diagnostic: " + diagnostic);
        }
    }

    public static Locator stableId(String id) {
        return new Locator(id, Kind.STABLE_ID, null);
    }

    public static Locator displayName(String name) {
        return new Locator(name, Kind.DISPLAY_NAME, DISPLAY_NAME_DIAGNOSTIC);
    }

    public static Locator structuralPath(String path) {
        return new Locator(path, Kind.STRUCTURAL_PATH, STRUCTURAL_PATH_DIAGNOSTIC);
    }

    public static Locator unresolved(String value, String error) {
        return new Locator(value, Kind.COORDINATE, error);
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    /** False for the coordinate sentinel, which must never be treated as durable. */
    public boolean isDurable() {
        return kind != Kind.COORDINATE;
    }

    public LocatorQuality quality() {
        return switch (kind) {
            case STABLE_ID       -> LocatorQuality.HIGH;
            case DISPLAY_NAME    -> LocatorQuality.MEDIUM;
            case STRUCTURAL_PATH,
                 COORDINATE      -> LocatorQuality.LOW;
        };
    }

    @Override
    public String toString() {
        return String.format("Locator{%s='%s'%s}", kind, value,
                diagnostic != null ? " (" + diagnostic + ")" : "");
    }
}

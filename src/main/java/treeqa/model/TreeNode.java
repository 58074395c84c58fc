package treeqa.model;

import java.util.List;
import java.util.Optional;

/**
 * Read-only handle onto one control of a live UI control tree.
 *
 * <p>Implemented by the UI framework adapter (or by
 * {@link treeqa.snapshot.SnapshotNode} for offline trees). The recorder and
 * player only ever read nodes; they never mutate them.
 *
 * <p>Adapters may hand out a fresh handle on every navigation, but handles
 * onto the same control must be {@link Object#equals equal} and share a
 * {@link Object#hashCode hash code}.
 *
 * <p>All methods must be called on the owner (UI) thread of the tree.
 */
public interface TreeNode {

    /** Declared automation / stable id, or an empty string when none is declared. */
    String stableId();

    /** Declared display name, or an empty string when none is declared. */
    String displayName();

    /** Type tag distinguishing control kinds, e.g. {@code "Button"} or {@code "TextBox"}. */
    String typeTag();

    /** Parent node, or empty at the root boundary (e.g. the window). */
    Optional<TreeNode> parent();

    /** Children in visual order. Never {@code null}. */
    List<TreeNode> orderedChildren();

    /**
     * Bounds in root coordinates, or {@code null} when layout has not produced
     * any yet.
     */
    Bounds bounds();

    /**
     * Named control value such as {@code text}, {@code content}, {@code checked},
     * {@code visible}, {@code enabled} or {@code selectedItem}.
     *
     * @return the value as a string, or {@code null} when the control has no such property
     */
    String property(String name);

    default boolean boundsKnown() {
        return bounds() != null;
    }

    default boolean isRootBoundary() {
        return parent().isEmpty();
    }

    default boolean hasStableId() {
        String id = stableId();
        return id != null && !id.isBlank();
    }

    default boolean hasDisplayName() {
        String name = displayName();
        return name != null && !name.isBlank();
    }
}

package treeqa.model;

import java.util.List;
import java.util.Optional;

/**
 * Port onto the UI framework's live control graph for one root (window).
 *
 * <p>Only {@link #root()} is mandatory. Adapters that know the focused element
 * or have a native hit-test should override the defaults.
 */
public interface TreeAccess {

    /** The root boundary of the tree. Upward traversal stops here. */
    TreeNode root();

    /** The node that currently holds keyboard focus, if known. */
    default Optional<TreeNode> focused() {
        return Optional.empty();
    }

    /**
     * Returns the deepest node whose bounds contain the point. Later siblings
     * are drawn on top of earlier ones, so children are probed last-to-first.
     */
    default Optional<TreeNode> hitTest(double x, double y) {
        return Optional.ofNullable(hitTest(root(), x, y));
    }

    private static TreeNode hitTest(TreeNode node, double x, double y) {
        Bounds b = node.bounds();
        if (b != null && !b.contains(x, y)) return null;

        List<TreeNode> children = node.orderedChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            TreeNode hit = hitTest(children.get(i), x, y);
            if (hit != null) return hit;
        }
        return b != null ? node : null;
    }

    /** Wraps a bare root node. */
    static TreeAccess of(TreeNode root) {
        return () -> root;
    }
}

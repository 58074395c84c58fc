package treeqa.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/** Depth-first walks over a {@link TreeNode} graph. */
public final class TreeTraversal {

    private TreeTraversal() {}

    /** All nodes under {@code start} in pre-order, {@code start} included. */
    public static List<TreeNode> preOrder(TreeNode start) {
        return collect(start, n -> true, true);
    }

    /** Pre-order matches of {@code filter}, optionally excluding {@code start} itself. */
    public static List<TreeNode> collect(TreeNode start, Predicate<TreeNode> filter, boolean includeStart) {
        List<TreeNode> out = new ArrayList<>();
        if (includeStart && filter.test(start)) out.add(start);
        for (TreeNode child : start.orderedChildren()) {
            walk(child, filter, out);
        }
        return out;
    }

    private static void walk(TreeNode node, Predicate<TreeNode> filter, List<TreeNode> out) {
        if (filter.test(node)) out.add(node);
        for (TreeNode child : node.orderedChildren()) {
            walk(child, filter, out);
        }
    }

    /** Stable ids of every node in the tree, in pre-order, without duplicates. */
    public static List<String> stableIds(TreeNode root) {
        return preOrder(root).stream()
                .filter(TreeNode::hasStableId)
                .map(TreeNode::stableId)
                .distinct()
                .toList();
    }
}

package treeqa.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural paths of the form {@code Type[idx]/Type[idx]/...}, where
 * {@code idx} is the zero-based position among siblings that share the same
 * type tag. The root boundary itself is never part of a path.
 *
 * <p>A type tag may contain any character except {@code /}, {@code [} and
 * {@code ]}. Leading and trailing whitespace of a segment is ignored.
 */
public final class StructuralPath {

    public static final String SEPARATOR = "/";

    private static final Pattern SEGMENT = Pattern.compile("^([^/\\[\\]]+)\\[(\\d+)]$");

    /** One {@code Type[idx]} element of a path. */
    public record Segment(String typeTag, int index) {
        @Override
        public String toString() {
            return typeTag + "[" + index + "]";
        }
    }

    private StructuralPath() {}

    // ── Building ──────────────────────────────────────────────────────────

    /**
     * Computes the path from the root boundary down to {@code node}.
     * Returns an empty string when {@code node} is the root boundary.
     */
    public static String of(TreeNode node) {
        List<String> parts = new ArrayList<>();
        TreeNode current = node;
        while (!current.isRootBoundary()) {
            parts.add(segmentOf(current).toString());
            current = current.parent().orElseThrow();
        }
        Collections.reverse(parts);
        return String.join(SEPARATOR, parts);
    }

    /** The segment a node occupies under its parent (index 0 at the root boundary). */
    public static Segment segmentOf(TreeNode node) {
        return new Segment(node.typeTag(), sameTypeIndex(node));
    }

    /**
     * Position of {@code node} among its parent's children with the same type
     * tag. Siblings are compared with {@link Object#equals}.
     */
    public static int sameTypeIndex(TreeNode node) {
        Optional<TreeNode> parent = node.parent();
        if (parent.isEmpty()) return 0;
        int index = 0;
        for (TreeNode sibling : parent.get().orderedChildren()) {
            if (sibling.equals(node)) return index;
            if (sibling.typeTag().equals(node.typeTag())) index++;
        }
        throw new IllegalStateException(
                "Node " + node.typeTag() + " is not among its parent's children");
    }

    /** True when both nodes sit at the same structural path. */
    public static boolean sameLocation(TreeNode a, TreeNode b) {
        return of(a).equals(of(b));
    }

    // ── Parsing ───────────────────────────────────────────────────────────

    /**
     * True when the string is shaped like a path rather than a bare
     * identifier. Such strings are not necessarily well-formed.
     */
    public static boolean looksLikePath(String value) {
        return value.contains(SEPARATOR) || value.contains("[");
    }

    /**
     * Parses a path into its segments.
     *
     * @throws IllegalArgumentException if any segment is not {@code Type[idx]}
     */
    public static List<Segment> parse(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Structural path is empty");
        }
        List<Segment> segments = new ArrayList<>();
        for (String part : path.split(SEPARATOR, -1)) {
            Matcher m = SEGMENT.matcher(part.trim());
            if (!m.matches()) {
                throw new IllegalArgumentException(
                        "Malformed segment '" + part + "' in structural path '" + path + "'");
            }
            try {
                segments.add(new Segment(m.group(1), Integer.parseInt(m.group(2))));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Index out of range in segment '" + part + "' of '" + path + "'", e);
            }
        }
        return List.copyOf(segments);
    }
}

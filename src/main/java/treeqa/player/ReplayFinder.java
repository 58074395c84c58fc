package treeqa.player;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.model.Locator;
import treeqa.model.StructuralPath;
import treeqa.model.StructuralPath.Segment;
import treeqa.model.TreeAccess;
import treeqa.model.TreeNode;
import treeqa.model.TreeTraversal;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the control a recorded locator designates in the current tree,
 * trying strategies in priority order: stable id → display name → structural
 * path.
 *
 * <p>Structural-path matching tolerates trees that differ from the one
 * observed at recording time. When a segment's exact {@code Type[idx]} is
 * absent it falls back to the first child of that type, then to a descendant
 * of that type (the recorded index is a hint among them), and finally skips
 * the segment. A path of which no segment matched at all is a failure.
 *
 * <p>Used by the recorder to validate freshly recorded steps and by
 * {@link UiPlayer} at replay time. Must be called on the owner thread.
 */
public class ReplayFinder {

    private static final Logger log = LoggerFactory.getLogger(ReplayFinder.class);

    /** Which lookup strategy decided a result. */
    public enum Strategy { STABLE_ID, DISPLAY_NAME, STRUCTURAL_PATH }

    /**
     * Outcome of one lookup: the deciding strategy and all its matches in
     * pre-order, or no matches plus a human-readable reason.
     */
    public record Lookup(Strategy strategy, List<TreeNode> candidates, String failure) {

        public boolean found() {
            return !candidates.isEmpty();
        }

        public boolean ambiguous() {
            return candidates.size() > 1;
        }

        static Lookup of(Strategy strategy, List<TreeNode> candidates) {
            return new Lookup(strategy, List.copyOf(candidates), null);
        }

        static Lookup notFound(String failure) {
            return new Lookup(null, List.of(), failure);
        }
    }

    private final TreeAccess tree;

    public ReplayFinder(TreeAccess tree) {
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    public ReplayFinder(TreeNode root) {
        this(TreeAccess.of(root));
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Finds the control for a locator string. When several controls share a
     * stable id or display name the first in document order wins.
     *
     * @throws LocatorNotFoundException if no strategy matched, including malformed paths
     */
    public TreeNode find(String locator) {
        Lookup lookup = lookup(locator);
        if (!lookup.found()) {
            throw notFound(locator, lookup.failure());
        }
        if (lookup.ambiguous()) {
            log.warn("Locator '{}' matched {} controls by {}; using the first",
                    locator, lookup.candidates().size(), lookup.strategy());
        }
        TreeNode node = lookup.candidates().get(0);
        log.debug("Located '{}' by {}: {}", locator, lookup.strategy(), node);
        return node;
    }

    public TreeNode find(Locator locator) {
        return find(locator.value());
    }

    /** Like {@link #find(String)} but returns empty instead of throwing. */
    public Optional<TreeNode> tryFind(String locator) {
        Lookup lookup = lookup(locator);
        return lookup.found() ? Optional.of(lookup.candidates().get(0)) : Optional.empty();
    }

    /** All matches of the strategy that decides {@code locator}; empty when none matched. */
    public List<TreeNode> candidates(String locator) {
        return lookup(locator).candidates();
    }

    /** Builds the not-found error for {@code locator}, listing every stable id of the current tree. */
    public LocatorNotFoundException notFound(String locator, String detail) {
        List<String> ids = TreeTraversal.stableIds(tree.root());
        log.error("Control not found: '{}' ({}); {} stable ids in tree", locator, detail, ids.size());
        return new LocatorNotFoundException(locator, ids, detail);
    }

    /** Runs the strategy chain without throwing. */
    public Lookup lookup(String locator) {
        if (locator == null || locator.isBlank()) {
            return Lookup.notFound("Locator is empty");
        }
        TreeNode root = tree.root();

        // ── 1. Stable id ───────────────────────────────────────────────
        List<TreeNode> byId = TreeTraversal.collect(root, n -> locator.equals(n.stableId()), true);
        if (!byId.isEmpty()) return Lookup.of(Strategy.STABLE_ID, byId);
        log.debug("[STABLE_ID] no match: {}", locator);

        // ── 2. Display name ────────────────────────────────────────────
        List<TreeNode> byName = TreeTraversal.collect(root, n -> locator.equals(n.displayName()), true);
        if (!byName.isEmpty()) return Lookup.of(Strategy.DISPLAY_NAME, byName);
        log.debug("[DISPLAY_NAME] no match: {}", locator);

        // ── 3. Structural path ─────────────────────────────────────────
        if (!StructuralPath.looksLikePath(locator)) {
            return Lookup.notFound("No control declares it as stable id or display name");
        }
        List<Segment> segments;
        try {
            segments = StructuralPath.parse(locator);
        } catch (IllegalArgumentException e) {
            log.debug("[STRUCTURAL_PATH] unparsable: {}", e.getMessage());
            return Lookup.notFound(e.getMessage());
        }
        TreeNode match = matchPath(root, segments);
        if (match == null) {
            return Lookup.notFound("No segment of the structural path matched the current tree");
        }
        return Lookup.of(Strategy.STRUCTURAL_PATH, List.of(match));
    }

    // ── Structural path matching ──────────────────────────────────────────

    private TreeNode matchPath(TreeNode root, List<Segment> segments) {
        TreeNode current = root;
        int matched = 0;
        for (Segment seg : segments) {
            TreeNode next = matchSegment(current, seg);
            if (next == null) {
                log.debug("[STRUCTURAL_PATH] skipping segment {} under {}", seg, current);
                continue;
            }
            current = next;
            matched++;
        }
        return matched == 0 ? null : current;
    }

    private TreeNode matchSegment(TreeNode current, Segment seg) {
        List<TreeNode> sameType = current.orderedChildren().stream()
                .filter(c -> seg.typeTag().equals(c.typeTag()))
                .toList();
        if (seg.index() < sameType.size()) {
            return sameType.get(seg.index());
        }
        if (!sameType.isEmpty()) {
            log.debug("[STRUCTURAL_PATH] {} out of range ({} of that type), using the first", seg, sameType.size());
            return sameType.get(0);
        }
        List<TreeNode> descendants = TreeTraversal.collect(current, n -> seg.typeTag().equals(n.typeTag()), false);
        if (descendants.isEmpty()) return null;
        log.debug("[STRUCTURAL_PATH] {} found among {} descendants", seg, descendants.size());
        return seg.index() < descendants.size() ? descendants.get(seg.index()) : descendants.get(0);
    }
}

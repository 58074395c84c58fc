package treeqa.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.model.Locator;
import treeqa.model.StructuralPath;
import treeqa.model.TreeNode;

import java.util.Locale;
import java.util.Optional;

/**
 * Computes the most stable locator for a control by trying strategies in
 * priority order: stable-id ancestor → display-name ancestor → structural
 * path → coordinate sentinel.
 *
 * <p>The ancestor walks start at the node itself and stop below the root
 * boundary, so a node nested under identified ancestors resolves to the
 * nearest one. The root boundary only answers for itself. Display-name and
 * structural-path fallbacks are gated by {@link RecorderConfig}.
 *
 * <p>Tree reads happen on the owner thread; calls from any other thread are
 * dispatched through the {@link OwnerContext}.
 */
public class LocatorResolver {

    private static final Logger log = LoggerFactory.getLogger(LocatorResolver.class);

    public static final String WARN_DISPLAY_NAME    = "WARNING: fallback locator (display name)";
    public static final String WARN_STRUCTURAL_PATH = "CRITICAL: structural path locator - high risk of breakage";
    public static final String ERROR_NO_LOCATOR     = "ERROR: no stable locator available";

    private final RecorderConfig config;
    private final OwnerContext owner;

    public LocatorResolver(RecorderConfig config, OwnerContext owner) {
        this.config = config;
        this.owner = owner;
    }

    // ── Public API ────────────────────────────────────────────────────────

    public Resolution resolve(TreeNode node) {
        return resolve(node, Double.NaN, Double.NaN);
    }

    /**
     * Resolves a locator for {@code node}.
     *
     * @param node     the event source; {@code null} yields the coordinate sentinel
     * @param pointerX last pointer x, or NaN when unknown (used only by the sentinel)
     * @param pointerY last pointer y, or NaN when unknown
     */
    public Resolution resolve(TreeNode node, double pointerX, double pointerY) {
        if (!owner.isOwnerThread()) {
            return owner.invoke(() -> resolveOnOwner(node, pointerX, pointerY));
        }
        return resolveOnOwner(node, pointerX, pointerY);
    }

    // ── Internal helpers ─────────────────────────────────────────────────

    private Resolution resolveOnOwner(TreeNode node, double pointerX, double pointerY) {
        if (node == null) {
            return unresolvable(null, pointerX, pointerY);
        }

        // ── 1. Stable id ───────────────────────────────────────────────
        Optional<TreeNode> withId = nearestAncestor(node, true);
        if (withId.isPresent()) {
            TreeNode target = withId.get();
            log.debug("Resolved [STABLE_ID] '{}' for {}", target.stableId(), node.typeTag());
            return new Resolution(Locator.stableId(target.stableId()), target, null);
        }

        // ── 2. Display name ────────────────────────────────────────────
        if (config.isPreferDisplayNameFallback()) {
            Optional<TreeNode> withName = nearestAncestor(node, false);
            if (withName.isPresent()) {
                TreeNode target = withName.get();
                log.warn("Resolved locator via display name fallback: '{}'", target.displayName());
                return new Resolution(Locator.displayName(target.displayName()), target,
                        config.isEmitFallbackWarnings() ? WARN_DISPLAY_NAME : null);
            }
        }

        // ── 3. Structural path ─────────────────────────────────────────
        if (config.isAllowStructuralPathFallback() && !node.isRootBoundary()) {
            String path = StructuralPath.of(node);
            log.warn("Resolved locator via structural path: {}", path);
            return new Resolution(Locator.structuralPath(path), node,
                    config.isEmitFallbackWarnings() ? WARN_STRUCTURAL_PATH : null);
        }

        return unresolvable(node, pointerX, pointerY);
    }

    private Resolution unresolvable(TreeNode node, double pointerX, double pointerY) {
        String value;
        if (!Double.isNaN(pointerX) && !Double.isNaN(pointerY)) {
            value = String.format(Locale.ROOT, "%.0f,%.0f", pointerX, pointerY);
        } else {
            value = (node != null ? node.typeTag() : "Unknown") + "_NoId";
        }
        log.error("Could not resolve a stable locator for {} (sentinel '{}')",
                node != null ? node.typeTag() : "pointer", value);
        return new Resolution(Locator.unresolved(value, ERROR_NO_LOCATOR), node, ERROR_NO_LOCATOR);
    }

    /**
     * First node from {@code node} upward with a stable id (or display name).
     * The root boundary is only considered when it is {@code node} itself.
     */
    private static Optional<TreeNode> nearestAncestor(TreeNode node, boolean byStableId) {
        TreeNode current = node;
        while (current != null) {
            if (byStableId ? current.hasStableId() : current.hasDisplayName()) {
                return Optional.of(current);
            }
            if (current.isRootBoundary()) break;
            TreeNode parent = current.parent().orElseThrow();
            current = parent.isRootBoundary() ? null : parent;
        }
        return Optional.empty();
    }
}

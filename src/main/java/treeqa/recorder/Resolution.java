package treeqa.recorder;

import treeqa.model.Locator;
import treeqa.model.TreeNode;

/**
 * Result of resolving a locator for an event source.
 *
 * @param locator the computed locator
 * @param target  the node the locator designates (the nearest identified
 *                ancestor, possibly not the event source), or {@code null}
 *                for the coordinate sentinel when no node was under the pointer
 * @param warning step comment derived from the locator kind, or {@code null}
 */
public record Resolution(Locator locator, TreeNode target, String warning) {
}

package treeqa.recorder.assertion;

import treeqa.model.StepKind;
import treeqa.model.TreeNode;

import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the extractor table: when {@code matches} accepts a control,
 * {@code extract} reads the value to assert.
 */
public record AssertionRule(String name, Predicate<TreeNode> matches, Function<TreeNode, AssertionValue> extract) {

    /** Rule for controls whose type tag is one of {@code typeTags}. */
    public static AssertionRule forTypes(String name, Set<String> typeTags, Function<TreeNode, AssertionValue> extract) {
        return new AssertionRule(name, n -> typeTags.contains(n.typeTag()), extract);
    }

    /** Rule asserting {@code kind} with the value of a named property. */
    public static AssertionRule property(String name, Predicate<TreeNode> matches, StepKind kind, String property) {
        return new AssertionRule(name, matches, n -> {
            String v = n.property(property);
            return new AssertionValue(kind, v == null ? "" : v);
        });
    }
}

package treeqa.recorder.assertion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.model.ControlProperties;
import treeqa.model.StepKind;
import treeqa.model.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered table of {@link AssertionRule}s; the first rule whose predicate
 * matches the target control wins.
 *
 * <p>Built-in rules, in order:
 * <ol>
 *   <li>toggles ({@code CheckBox}, {@code ToggleButton}, {@code RadioButton}, {@code ToggleSwitch})
 *       in a definite state → checked state</li>
 *   <li>text controls ({@code TextBox}, {@code TextBlock}, {@code PasswordBox}) → text</li>
 *   <li>content controls ({@code Button}, {@code Label}, {@code ContentControl}, ...) with non-empty content → content as text</li>
 *   <li>any visible control → visible</li>
 * </ol>
 * Rules added through {@link #withRule(AssertionRule)} are consulted before the built-ins.
 */
public final class AssertionExtractors {

    private static final Logger log = LoggerFactory.getLogger(AssertionExtractors.class);

    public static final Set<String> TOGGLE_TYPES =
            Set.of("CheckBox", "ToggleButton", "RadioButton", "ToggleSwitch");
    public static final Set<String> TEXT_TYPES =
            Set.of("TextBox", "TextBlock", "PasswordBox");
    public static final Set<String> CONTENT_TYPES =
            Set.of("Button", "Label", "ContentControl", "HeaderedContentControl", "Expander", "RepeatButton");

    private final List<AssertionRule> rules;

    private AssertionExtractors(List<AssertionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static AssertionExtractors defaults() {
        return new AssertionExtractors(builtInRules());
    }

    /** A table with exactly {@code rules}, no built-ins. */
    public static AssertionExtractors of(List<AssertionRule> rules) {
        return new AssertionExtractors(rules);
    }

    /** Returns a copy with {@code rule} placed before all existing rules. */
    public AssertionExtractors withRule(AssertionRule rule) {
        List<AssertionRule> copy = new ArrayList<>(rules.size() + 1);
        copy.add(rule);
        copy.addAll(rules);
        return new AssertionExtractors(copy);
    }

    public List<AssertionRule> rules() {
        return rules;
    }

    /** Runs the first matching rule; empty when no rule matches. */
    public Optional<AssertionValue> extract(TreeNode target) {
        for (AssertionRule rule : rules) {
            if (rule.matches().test(target)) {
                AssertionValue value = rule.extract().apply(target);
                log.debug("Assertion rule '{}' matched {}: {}", rule.name(), target.typeTag(), value);
                return Optional.ofNullable(value);
            }
        }
        log.warn("No assertion rule matches control of type {}", target.typeTag());
        return Optional.empty();
    }

    // ── Built-in rules ────────────────────────────────────────────────────

    private static List<AssertionRule> builtInRules() {
        return List.of(
                new AssertionRule("toggle", n -> TOGGLE_TYPES.contains(n.typeTag()) && hasToggleState(n),
                        n -> new AssertionValue(StepKind.ASSERT_CHECKED,
                                String.valueOf(ControlProperties.flag(n, ControlProperties.CHECKED, false)))),
                AssertionRule.property("text", n -> TEXT_TYPES.contains(n.typeTag()),
                        StepKind.ASSERT_TEXT, ControlProperties.TEXT),
                AssertionRule.property("content", n -> CONTENT_TYPES.contains(n.typeTag()) && hasContent(n),
                        StepKind.ASSERT_TEXT, ControlProperties.CONTENT),
                new AssertionRule("visible", n -> ControlProperties.flag(n, ControlProperties.VISIBLE, true),
                        n -> new AssertionValue(StepKind.ASSERT_VISIBLE, "true")));
    }

    /** Indeterminate toggles report neither {@code true} nor {@code false}. */
    private static boolean hasToggleState(TreeNode n) {
        String checked = n.property(ControlProperties.CHECKED);
        return "true".equalsIgnoreCase(checked) || "false".equalsIgnoreCase(checked);
    }

    private static boolean hasContent(TreeNode n) {
        String content = n.property(ControlProperties.CONTENT);
        return content != null && !content.isEmpty();
    }
}

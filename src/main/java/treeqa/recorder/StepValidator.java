package treeqa.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.model.Step;
import treeqa.model.StructuralPath;
import treeqa.model.TreeNode;
import treeqa.model.ValidationResult;
import treeqa.player.ReplayFinder;

/**
 * Re-resolves a freshly recorded step's locator against the current tree and
 * checks that it designates the same control. Controls are compared by
 * structural path, not identity.
 */
public class StepValidator {

    private static final Logger log = LoggerFactory.getLogger(StepValidator.class);

    public static final String AMBIGUOUS = "locator is ambiguous — multiple nodes may share it";
    public static final String FAILURE_PREFIX = "VALIDATION FAILED: ";

    private final ReplayFinder finder;

    public StepValidator(ReplayFinder finder) {
        this.finder = finder;
    }

    /**
     * @param step         the recorded step
     * @param originalNode the node the locator was computed for
     */
    public ValidationResult validate(Step step, TreeNode originalNode) {
        if (!step.kind().isControlScoped() || step.locator().isEmpty()) {
            return ValidationResult.success();
        }
        String value = step.locator().value();
        ReplayFinder.Lookup lookup = finder.lookup(value);

        if (!lookup.found()) {
            log.debug("Validation: '{}' not found ({})", value, lookup.failure());
            return ValidationResult.failed("not found: " + lookup.failure());
        }
        if (lookup.ambiguous()) {
            log.debug("Validation: '{}' matched {} controls by {}", value, lookup.candidates().size(), lookup.strategy());
            return ValidationResult.failed(AMBIGUOUS);
        }
        if (originalNode == null) {
            return ValidationResult.failed("not found: no originating control");
        }
        TreeNode found = lookup.candidates().get(0);
        if (!found.equals(originalNode) && !StructuralPath.sameLocation(found, originalNode)) {
            log.debug("Validation: '{}' found {} but recorded {}", value,
                    StructuralPath.of(found), StructuralPath.of(originalNode));
            return ValidationResult.failed(AMBIGUOUS);
        }
        return ValidationResult.success();
    }
}

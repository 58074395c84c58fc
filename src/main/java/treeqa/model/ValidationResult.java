package treeqa.model;

/**
 * Outcome of re-resolving a freshly recorded step. Never persisted; a failure
 * only survives as a warning on the step.
 */
public record ValidationResult(boolean ok, String reason) {

    private static final ValidationResult OK = new ValidationResult(true, null);

    public static ValidationResult success() {
        return OK;
    }

    public static ValidationResult failed(String reason) {
        return new ValidationResult(false, reason);
    }
}

package treeqa.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One recorded interaction. Immutable: a validation failure is folded in via
 * {@link #withWarning(String)} before the step is appended to a session.
 *
 * @param kind      interaction kind
 * @param locator   where the interaction happened ({@link Locator#NONE} for key presses)
 * @param parameter typed text, key name, scroll delta {@code "dx,dy"} or asserted value
 * @param warning   comment rendered next to the generated call, or {@code null}
 * @param timestamp when the interaction was recorded
 */
public record Step(StepKind kind, Locator locator, String parameter, String warning, Instant timestamp) {

    /** Separator between several warnings on the same step; renders as consecutive comments. */
    public static final String WARNING_SEPARATOR = " // ";

    public Step {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(locator, "locator");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public LocatorQuality quality() {
        return locator.quality();
    }

    public boolean hasWarning() {
        return warning != null;
    }

    /** Returns a copy with {@code extra} appended to any existing warning. */
    public Step withWarning(String extra) {
        if (extra == null || extra.isBlank()) return this;
        String merged = warning == null ? extra : warning + WARNING_SEPARATOR + extra;
        return new Step(kind, locator, parameter, merged, timestamp);
    }

    @Override
    public String toString() {
        return String.format("Step{%s %s%s%s}", kind, locator.value(),
                parameter != null ? " param='" + parameter + "'" : "",
                warning != null ? " warning='" + warning + "'" : "");
    }
}

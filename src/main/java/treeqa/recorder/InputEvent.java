package treeqa.recorder;

import treeqa.model.TreeNode;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A raw user-input event delivered by an {@link InputSource}.
 *
 * <p>{@code source} is the control the UI framework routed the event to; it
 * may be {@code null}, in which case the session hit-tests the pointer
 * position or falls back to the focused control. Pointer coordinates are in
 * root space and {@link Double#NaN} when unknown.
 */
public record InputEvent(Type type, TreeNode source, Button button, double x, double y,
                         String text, String key, Set<Modifier> modifiers, double dx, double dy) {

    public enum Type { POINTER_PRESS, POINTER_MOVE, TEXT_INPUT, KEY_DOWN, SCROLL }

    public enum Button { LEFT, MIDDLE, RIGHT }

    public enum Modifier {
        CTRL("Ctrl"), SHIFT("Shift"), ALT("Alt"), META("Meta");

        private final String label;

        Modifier(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        /** Accepts the label and common aliases ({@code Control}, {@code Cmd}, {@code Win}). */
        public static Modifier fromName(String name) {
            switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "ctrl": case "control": return CTRL;
                case "shift":                return SHIFT;
                case "alt": case "option":   return ALT;
                case "meta": case "cmd": case "command": case "win": case "super": return META;
                default: throw new IllegalArgumentException("Unknown modifier: " + name);
            }
        }
    }

    public InputEvent {
        Objects.requireNonNull(type, "type");
        modifiers = modifiers == null || modifiers.isEmpty() ? Set.of() : Set.copyOf(modifiers);
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public static InputEvent press(TreeNode source, Button button, double x, double y) {
        return new InputEvent(Type.POINTER_PRESS, source, button, x, y, null, null, null, 0, 0);
    }

    public static InputEvent press(TreeNode source, Button button) {
        return press(source, button, Double.NaN, Double.NaN);
    }

    public static InputEvent move(TreeNode source, double x, double y) {
        return new InputEvent(Type.POINTER_MOVE, source, null, x, y, null, null, null, 0, 0);
    }

    public static InputEvent text(TreeNode source, String text) {
        return new InputEvent(Type.TEXT_INPUT, source, null, Double.NaN, Double.NaN, text, null, null, 0, 0);
    }

    public static InputEvent keyDown(TreeNode source, String key, Modifier... modifiers) {
        Set<Modifier> mods = modifiers.length == 0 ? Set.of() : EnumSet.of(modifiers[0], modifiers);
        return new InputEvent(Type.KEY_DOWN, source, null, Double.NaN, Double.NaN, null, key, mods, 0, 0);
    }

    public static InputEvent scroll(TreeNode source, double dx, double dy) {
        return new InputEvent(Type.SCROLL, source, null, Double.NaN, Double.NaN, null, null, null, dx, dy);
    }

    public boolean hasPosition() {
        return !Double.isNaN(x) && !Double.isNaN(y);
    }
}

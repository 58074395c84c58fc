package treeqa.recorder;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Non-printable navigation and editing keys recorded as key-press steps.
 * Printable characters arrive as text input instead.
 */
final class SpecialKeys {

    private static final Map<String, String> CANONICAL = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    static {
        for (String k : new String[] {
                "Enter", "Tab", "Escape", "Backspace", "Delete", "Home", "End",
                "PageUp", "PageDown", "Up", "Down", "Left", "Right"}) {
            CANONICAL.put(k, k);
        }
        for (int i = 1; i <= 12; i++) CANONICAL.put("F" + i, "F" + i);
        CANONICAL.put("Return", "Enter");
        CANONICAL.put("Esc", "Escape");
        CANONICAL.put("Back", "Backspace");
        CANONICAL.put("Del", "Delete");
        CANONICAL.put("Prior", "PageUp");
        CANONICAL.put("Next", "PageDown");
        CANONICAL.put("ArrowUp", "Up");
        CANONICAL.put("ArrowDown", "Down");
        CANONICAL.put("ArrowLeft", "Left");
        CANONICAL.put("ArrowRight", "Right");
    }

    private SpecialKeys() {}

    /** Canonical key name, or {@code null} when {@code key} is not a special key. */
    static String canonical(String key) {
        return key == null ? null : CANONICAL.get(key.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Prefixes {@code key} with the held modifiers in declaration order,
     * e.g. {@code Ctrl+Shift+Tab}.
     */
    static String chord(Set<InputEvent.Modifier> modifiers, String key) {
        return modifiers.stream()
                .sorted()
                .map(m -> m.label() + "+")
                .collect(Collectors.joining()) + key;
    }
}

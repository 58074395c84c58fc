package treeqa.recorder;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A key plus modifiers, parsed from strings like {@code Ctrl+Shift+R}.
 * Key names compare case-insensitively.
 */
public record Hotkey(Set<InputEvent.Modifier> modifiers, String key) {

    public Hotkey {
        modifiers = modifiers.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(modifiers));
        key = key.toUpperCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if the string has no key or an unknown modifier
     */
    public static Hotkey parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty hotkey");
        }
        String[] parts = text.split("\\+");
        Set<InputEvent.Modifier> mods = EnumSet.noneOf(InputEvent.Modifier.class);
        for (int i = 0; i < parts.length - 1; i++) {
            mods.add(InputEvent.Modifier.fromName(parts[i]));
        }
        String key = parts[parts.length - 1].trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Hotkey has no key: " + text);
        }
        return new Hotkey(mods, key);
    }

    /** True for a key-down event with exactly these modifiers and this key. */
    public boolean matches(InputEvent event) {
        return event.type() == InputEvent.Type.KEY_DOWN
                && event.key() != null
                && key.equalsIgnoreCase(event.key())
                && modifiers.equals(event.modifiers());
    }

    @Override
    public String toString() {
        String mods = modifiers.stream()
                .sorted()
                .map(InputEvent.Modifier::label)
                .collect(Collectors.joining("+"));
        return mods.isEmpty() ? key : mods + "+" + key;
    }
}

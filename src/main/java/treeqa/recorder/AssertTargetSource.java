package treeqa.recorder;

import java.util.Locale;

/** Where assertion capture looks for its target control. */
public enum AssertTargetSource {

    /** The control the pointer most recently moved over. */
    HOVER("hover"),
    /** A hit-test at the last known pointer position. */
    POINTER_HIT_TEST("pointerHitTest"),
    /** The control holding keyboard focus. */
    FOCUSED("focused");

    private final String configName;

    AssertTargetSource(String configName) {
        this.configName = configName;
    }

    /** Case-insensitive lookup by config name; {@code null} when unknown. */
    static AssertTargetSource fromName(String name) {
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (AssertTargetSource s : values()) {
            if (s.configName.toLowerCase(Locale.ROOT).equals(n)) return s;
        }
        return null;
    }
}

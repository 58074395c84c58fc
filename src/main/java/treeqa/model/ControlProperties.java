package treeqa.model;

/** Names of the control values read through {@link TreeNode#property(String)}. */
public final class ControlProperties {

    public static final String TEXT          = "text";
    public static final String CONTENT       = "content";
    public static final String CHECKED       = "checked";
    public static final String VISIBLE       = "visible";
    public static final String ENABLED       = "enabled";
    public static final String SELECTED_ITEM = "selectedItem";

    private ControlProperties() {}

    /**
     * Reads a boolean property. An absent value yields {@code absentValue};
     * anything other than {@code "true"} (case-insensitive) is false.
     */
    public static boolean flag(TreeNode node, String name, boolean absentValue) {
        String raw = node.property(name);
        if (raw == null || raw.isBlank()) return absentValue;
        return Boolean.parseBoolean(raw.trim());
    }

    /** Visible text of a control: its {@code text}, else its {@code content}, else {@code null}. */
    public static String textOf(TreeNode node) {
        String text = node.property(TEXT);
        return text != null ? text : node.property(CONTENT);
    }
}

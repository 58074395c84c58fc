package treeqa.model;

/**
 * Kind of a recorded interaction step.
 */
public enum StepKind {
    CLICK, RIGHT_CLICK, DOUBLE_CLICK, TYPE_TEXT, KEY_PRESS,
    SCROLL, HOVER, SELECT_ITEM,
    ASSERT_TEXT, ASSERT_CHECKED, ASSERT_VISIBLE, ASSERT_ENABLED;

    public boolean isAssertion() {
        return name().startsWith("ASSERT_");
    }

    /** Key presses are the only steps not scoped to a control. */
    public boolean isControlScoped() {
        return this != KEY_PRESS;
    }
}

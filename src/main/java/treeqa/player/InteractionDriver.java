package treeqa.player;

import treeqa.model.TreeNode;

/**
 * Delivers synthetic input to controls at replay time. Implemented by the UI
 * framework's headless or automation layer.
 */
public interface InteractionDriver {

    enum MouseButton { LEFT, RIGHT }

    void click(TreeNode target, MouseButton button, int clickCount);

    void hover(TreeNode target);

    /** Focuses {@code target} and types {@code text} into it. */
    void typeText(TreeNode target, String text);

    /**
     * Sends a named key such as {@code Enter} or {@code F5} to the focused
     * control. Held modifiers come first, joined by {@code +}, as in
     * {@code Ctrl+Shift+Tab}.
     */
    void keyPress(String key);

    void scroll(TreeNode target, double dx, double dy);

    void selectItem(TreeNode target, String item);
}

package treeqa.player;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.model.ControlProperties;
import treeqa.model.TreeAccess;
import treeqa.model.TreeNode;
import treeqa.player.InteractionDriver.MouseButton;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Replay DSL called by generated tests. Every control-scoped call locates its
 * target through {@link ReplayFinder}; input goes through the
 * {@link InteractionDriver}.
 *
 * <pre>{@code
 * UiPlayer ui = new UiPlayer(tree, driver, new PlayerConfig());
 * ui.typeText("UserName", "alice");
 * ui.click("LoginButton");
 * ui.assertText("Status", "Welcome");
 * }</pre>
 *
 * <p>Must be used on the owner thread of the tree.
 */
public class UiPlayer {

    private static final Logger log = LoggerFactory.getLogger(UiPlayer.class);

    private final ReplayFinder finder;
    private final InteractionDriver driver;
    private final WaitStrategy wait;

    public UiPlayer(TreeAccess tree, InteractionDriver driver, PlayerConfig config) {
        this(new ReplayFinder(tree), driver, new WaitStrategy(config));
    }

    UiPlayer(ReplayFinder finder, InteractionDriver driver, WaitStrategy wait) {
        this.finder = Objects.requireNonNull(finder, "finder");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.wait = Objects.requireNonNull(wait, "wait");
    }

    // ── Input ─────────────────────────────────────────────────────────────

    public void click(String locator) {
        log.debug("click '{}'", locator);
        driver.click(finder.find(locator), MouseButton.LEFT, 1);
    }

    public void rightClick(String locator) {
        log.debug("rightClick '{}'", locator);
        driver.click(finder.find(locator), MouseButton.RIGHT, 1);
    }

    public void doubleClick(String locator) {
        log.debug("doubleClick '{}'", locator);
        driver.click(finder.find(locator), MouseButton.LEFT, 2);
    }

    public void hover(String locator) {
        log.debug("hover '{}'", locator);
        driver.hover(finder.find(locator));
    }

    public void typeText(String locator, String text) {
        log.debug("typeText '{}' ({} chars)", locator, text.length());
        driver.typeText(finder.find(locator), text);
    }

    public void keyPress(String key) {
        log.debug("keyPress {}", key);
        driver.keyPress(key);
    }

    public void scroll(String locator, double dx, double dy) {
        log.debug("scroll '{}' by ({}, {})", locator, dx, dy);
        driver.scroll(finder.find(locator), dx, dy);
    }

    public void selectItem(String locator, String item) {
        log.debug("selectItem '{}' -> '{}'", locator, item);
        driver.selectItem(finder.find(locator), item);
    }

    // ── Assertions ────────────────────────────────────────────────────────

    /** Asserts the control's text (or content) equals {@code expected}. */
    public void assertText(String locator, String expected) {
        TreeNode node = finder.find(locator);
        String actual = ControlProperties.textOf(node);
        if (!Objects.equals(expected, actual)) {
            throw new TreeQAException(String.format(
                    "Text mismatch at '%s': expected '%s' but was '%s'", locator, expected, actual));
        }
    }

    public void assertChecked(String locator, boolean expected) {
        TreeNode node = finder.find(locator);
        if (node.property(ControlProperties.CHECKED) == null) {
            throw new TreeQAException("Control '" + locator + "' (" + node.typeTag() + ") has no checked state");
        }
        boolean actual = ControlProperties.flag(node, ControlProperties.CHECKED, false);
        if (actual != expected) {
            throw new TreeQAException(String.format(
                    "Checked mismatch at '%s': expected %s but was %s", locator, expected, actual));
        }
    }

    /** Controls without a {@code visible} property are considered visible. */
    public void assertVisible(String locator) {
        if (!ControlProperties.flag(finder.find(locator), ControlProperties.VISIBLE, true)) {
            throw new TreeQAException("Control '" + locator + "' is not visible");
        }
    }

    /** Controls without an {@code enabled} property are considered enabled. */
    public void assertEnabled(String locator) {
        if (!ControlProperties.flag(finder.find(locator), ControlProperties.ENABLED, true)) {
            throw new TreeQAException("Control '" + locator + "' is not enabled");
        }
    }

    // ── Waits ─────────────────────────────────────────────────────────────

    /** Polls until {@code locator} resolves, then returns the control. */
    public TreeNode waitFor(String locator) {
        return waitFor(locator, "control '" + locator + "'", n -> true);
    }

    /** Polls until the control resolves and satisfies {@code condition}, then returns it. */
    public TreeNode waitFor(String locator, Predicate<TreeNode> condition) {
        return waitFor(locator, "condition on '" + locator + "'", condition);
    }

    /** Polls until the control resolves and shows {@code expected} as its text. */
    public void waitForText(String locator, String expected) {
        waitFor(locator, "text '" + expected + "' at '" + locator + "'",
                n -> Objects.equals(expected, ControlProperties.textOf(n)));
    }

    public void waitForVisible(String locator) {
        waitFor(locator, "'" + locator + "' to become visible",
                n -> ControlProperties.flag(n, ControlProperties.VISIBLE, true));
    }

    public void waitForEnabled(String locator) {
        waitFor(locator, "'" + locator + "' to become enabled",
                n -> ControlProperties.flag(n, ControlProperties.ENABLED, true));
    }

    private TreeNode waitFor(String locator, String description, Predicate<TreeNode> condition) {
        try {
            return wait.until(description, () -> finder.tryFind(locator).filter(condition));
        } catch (TreeQAException timeout) {
            throw finder.notFound(locator, timeout.getMessage());
        }
    }
}

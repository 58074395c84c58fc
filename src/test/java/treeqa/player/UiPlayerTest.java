package treeqa.player;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import treeqa.TestTrees;
import treeqa.model.TreeAccess;
import treeqa.player.InteractionDriver.MouseButton;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class UiPlayerTest {

    private TestTrees.Login t;
    private InteractionDriver driver;
    private UiPlayer ui;

    @BeforeMethod
    public void setUp() {
        t = TestTrees.login();
        driver = mock(InteractionDriver.class);
        ui = new UiPlayer(new ReplayFinder(t.window), driver, new WaitStrategy(200, 10));
    }

    // ── Input ─────────────────────────────────────────────────────────────

    @Test(description = "Clicks are delivered to the located control")
    public void clickVariants() {
        ui.click("LoginButton");
        ui.rightClick("Cancel");
        ui.doubleClick("StackPanel[0]/StackPanel[0]/Button[2]");

        verify(driver).click(t.loginButton, MouseButton.LEFT, 1);
        verify(driver).click(t.cancel, MouseButton.RIGHT, 1);
        verify(driver).click(t.help, MouseButton.LEFT, 2);
    }

    @Test
    public void textKeysAndScroll() {
        ui.typeText("UserName", "alice");
        ui.keyPress("Enter");
        ui.scroll("MainWindow", 0, -120);
        ui.hover("Status");
        ui.selectItem("RememberMe", "yes");

        verify(driver).typeText(t.userName, "alice");
        verify(driver).keyPress("Enter");
        verify(driver).scroll(t.window, 0, -120);
        verify(driver).hover(t.status);
        verify(driver).selectItem(t.rememberMe, "yes");
    }

    @Test(description = "Unresolvable locators never reach the driver")
    public void notFoundBeforeInput() {
        assertThatThrownBy(() -> ui.click("Submit"))
                .isInstanceOf(LocatorNotFoundException.class)
                .hasMessageContaining("Available stable ids: MainWindow, UserName");
        verifyNoInteractions(driver);
    }

    // ── Assertions ────────────────────────────────────────────────────────

    @Test
    public void assertTextUsesTextThenContent() {
        t.status.property("text", "Welcome");

        assertThatCode(() -> ui.assertText("Status", "Welcome")).doesNotThrowAnyException();
        assertThatCode(() -> ui.assertText("LoginButton", "Log in")).doesNotThrowAnyException();
        assertThatThrownBy(() -> ui.assertText("Status", "Goodbye"))
                .isInstanceOf(TreeQAException.class)
                .hasMessage("Text mismatch at 'Status': expected 'Goodbye' but was 'Welcome'");
    }

    @Test
    public void assertChecked() {
        assertThatCode(() -> ui.assertChecked("RememberMe", false)).doesNotThrowAnyException();

        t.rememberMe.property("checked", "true");
        assertThatCode(() -> ui.assertChecked("RememberMe", true)).doesNotThrowAnyException();
        assertThatThrownBy(() -> ui.assertChecked("RememberMe", false))
                .hasMessageContaining("Checked mismatch");
        assertThatThrownBy(() -> ui.assertChecked("UserName", true))
                .hasMessageContaining("has no checked state");
    }

    @Test(description = "Visibility and enabled state default to true when the tree does not report them")
    public void visibleAndEnabled() {
        assertThatCode(() -> ui.assertVisible("Status")).doesNotThrowAnyException();
        assertThatCode(() -> ui.assertEnabled("LoginButton")).doesNotThrowAnyException();

        t.status.property("visible", "false");
        t.loginButton.property("enabled", "false");
        assertThatThrownBy(() -> ui.assertVisible("Status")).hasMessageContaining("not visible");
        assertThatThrownBy(() -> ui.assertEnabled("LoginButton")).hasMessageContaining("not enabled");
    }

    // ── Waits ─────────────────────────────────────────────────────────────

    @Test
    public void waitForPresentControl() {
        assertThat(ui.waitFor("Password")).isSameAs(t.password);
    }

    @Test(description = "A wait that never succeeds reports the locator as not found")
    public void waitForTimesOut() {
        assertThatThrownBy(() -> ui.waitFor("Spinner"))
                .isInstanceOf(LocatorNotFoundException.class)
                .hasMessageContaining("'Spinner'")
                .hasMessageContaining("Timed out after 200ms");
    }

    @Test
    public void waitForText() {
        t.status.property("text", "Ready");
        assertThatCode(() -> ui.waitForText("Status", "Ready")).doesNotThrowAnyException();
        assertThatThrownBy(() -> ui.waitForText("Status", "Done"))
                .isInstanceOf(LocatorNotFoundException.class)
                .hasMessageContaining("text 'Done' at 'Status'")
                .hasMessageContaining("Available stable ids: MainWindow, UserName");
    }

    @Test(description = "Waits for visibility and enabled state use the same defaults as the assertions")
    public void waitForVisibleAndEnabled() {
        t.loginButton.property("enabled", "false");
        t.status.property("visible", "false");

        assertThatCode(() -> ui.waitForVisible("LoginButton")).doesNotThrowAnyException();
        assertThatThrownBy(() -> ui.waitForEnabled("LoginButton"))
                .isInstanceOf(LocatorNotFoundException.class)
                .hasMessageContaining("'LoginButton' to become enabled");
        assertThatThrownBy(() -> ui.waitForVisible("Status"))
                .isInstanceOf(LocatorNotFoundException.class);
    }

    @Test(description = "A custom condition returns the control once it holds")
    public void waitForCondition() {
        assertThat(ui.waitFor("RememberMe", n -> "false".equals(n.property("checked")))).isSameAs(t.rememberMe);
        assertThatThrownBy(() -> ui.waitFor("RememberMe", n -> "true".equals(n.property("checked"))))
                .isInstanceOf(LocatorNotFoundException.class)
                .hasMessageContaining("condition on 'RememberMe'");
    }

    // ── Base class ────────────────────────────────────────────────────────

    @Test(description = "Generated tests obtain a working player from the base class")
    public void recordedTestBaseBindsTreeAndDriver() {
        RecordedTestBase base = new RecordedTestBase() {
            @Override
            protected TreeAccess tree() {
                return TreeAccess.of(t.window);
            }

            @Override
            protected InteractionDriver driver() {
                return driver;
            }

            @Override
            protected PlayerConfig playerConfig() {
                return PlayerConfig.of(new Properties());
            }
        };

        base.ui().click("Cancel");
        verify(driver).click(t.cancel, MouseButton.LEFT, 1);
    }
}

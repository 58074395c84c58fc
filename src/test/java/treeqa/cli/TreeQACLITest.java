package treeqa.cli;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import picocli.CommandLine;
import treeqa.TestTrees;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

public class TreeQACLITest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeMethod
    public void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cli = new CommandLine(new TreeQACLI());
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
    }

    private static String tree(String name) throws URISyntaxException {
        Path path = Paths.get(TreeQACLITest.class.getResource("/trees/" + name).toURI());
        return path.toString();
    }

    // ── find ──────────────────────────────────────────────────────────────

    @Test
    public void findByStableId() throws Exception {
        int exit = cli.execute("find", tree("login.json"), "LoginButton");

        assertThat(exit).isEqualTo(TreeQACLI.EXIT_OK);
        assertThat(out.toString())
                .contains("Button #LoginButton  [StackPanel[0]/StackPanel[0]/Button[0] by STABLE_ID]");
    }

    @Test(description = "Recorded paths still resolve after the layout gained a wrapper")
    public void findPathInDriftedTree() throws Exception {
        int exit = cli.execute("find", tree("login-drifted.json"), "StackPanel[0]/StackPanel[0]/Button[1]");

        assertThat(exit).isEqualTo(TreeQACLI.EXIT_OK);
        assertThat(out.toString()).contains("Button 'Cancel'").contains("by STRUCTURAL_PATH");
    }

    @Test
    public void findReportsMissingControl() throws Exception {
        int exit = cli.execute("find", tree("login.json"), "Submit");

        assertThat(exit).isEqualTo(TreeQACLI.EXIT_NOT_FOUND);
        assertThat(err.toString())
                .contains("Control not found: 'Submit'")
                .contains("Available stable ids: MainWindow, UserName, Password, RememberMe, LoginButton, Status.");
    }

    // ── resolve ───────────────────────────────────────────────────────────

    @Test(description = "An inner label resolves to its identified button")
    public void resolveInnerLabel() throws Exception {
        int exit = cli.execute("resolve", tree("login.json"), "StackPanel[0]/StackPanel[0]/Button[0]/TextBlock[0]");

        assertThat(exit).isEqualTo(TreeQACLI.EXIT_OK);
        assertThat(out.toString())
                .contains("locator:    LoginButton")
                .contains("quality:    HIGH")
                .contains("validation: ok")
                .doesNotContain("warning:");
    }

    @Test
    public void resolveStructuralPath() throws Exception {
        int exit = cli.execute("resolve", tree("login.json"), "StackPanel[0]/StackPanel[0]/Button[2]");

        assertThat(exit).isEqualTo(TreeQACLI.EXIT_OK);
        assertThat(out.toString())
                .contains("kind:       STRUCTURAL_PATH")
                .contains("warning:    CRITICAL: structural path locator - high risk of breakage");
    }

    @Test
    public void resolvePreferringDisplayName() throws Exception {
        int exit = cli.execute("resolve", "--prefer-display-name", tree("login.json"),
                "StackPanel[0]/StackPanel[0]/Button[1]");

        assertThat(exit).isEqualTo(TreeQACLI.EXIT_OK);
        assertThat(out.toString()).contains("locator:    Cancel").contains("kind:       DISPLAY_NAME");
    }

    @Test(description = "Without any fallback the sentinel is reported and fails validation")
    public void resolveWithoutFallbacks() throws Exception {
        int exit = cli.execute("resolve", "--no-structural-path", tree("login.json"),
                "StackPanel[0]/StackPanel[0]/Button[2]");

        assertThat(exit).isEqualTo(TreeQACLI.EXIT_NOT_FOUND);
        assertThat(out.toString())
                .contains("locator:    Button_NoId")
                .contains("validation: FAILED: not found");
    }

    @Test
    public void resolveRejectsBadPaths() throws Exception {
        assertThat(cli.execute("resolve", tree("login.json"), "StackPanel[0]/Button[9]"))
                .isEqualTo(TreeQACLI.EXIT_NOT_FOUND);
        assertThat(cli.execute("resolve", tree("login.json"), "StackPanel[zero]"))
                .isEqualTo(TreeQACLI.EXIT_BAD_INPUT);
        assertThat(err.toString()).contains("No control at exact path").contains("Malformed segment");
    }

    // ── dump and input errors ─────────────────────────────────────────────

    @Test
    public void dumpPrintsPaths() throws Exception {
        int exit = cli.execute("dump", tree("login.json"));

        assertThat(exit).isEqualTo(TreeQACLI.EXIT_OK);
        assertThat(out.toString())
                .startsWith("Window #MainWindow 'Login'  [(root)]")
                .contains("      Button  [StackPanel[0]/StackPanel[0]/Button[2]]")
                .contains("  TextBlock #Status  [StackPanel[0]/TextBlock[1]]");
    }

    @Test
    public void unreadableInput() throws Exception {
        assertThat(cli.execute("dump", "does/not/exist.json")).isEqualTo(TreeQACLI.EXIT_BAD_INPUT);
        assertThat(cli.execute("find", tree("invalid.json"), "X")).isEqualTo(TreeQACLI.EXIT_BAD_INPUT);
        assertThat(err.toString()).contains("Snapshot file not found").contains("Cannot read snapshot");
    }

    @Test
    public void describe() {
        TestTrees.Login t = TestTrees.login();
        assertThat(TreeQACLI.describe(t.window)).isEqualTo("Window #MainWindow 'Login'");
        assertThat(TreeQACLI.describe(t.help)).isEqualTo("Button");
        assertThat(TreeQACLI.navigateExact(t.window, "StackPanel[0]/CheckBox[0]")).isSameAs(t.rememberMe);
    }
}

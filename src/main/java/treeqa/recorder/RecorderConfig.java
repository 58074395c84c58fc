package treeqa.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeqa.codegen.TestFramework;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Reads recorder settings from {@code config.properties} (classpath) and
 * exposes typed accessor methods with sensible defaults.
 *
 * <p>An optional {@code config.local.properties} file on the classpath
 * overrides any value from the base file (higher priority; not committed to VCS).
 *
 * <h3>Supported keys and defaults</h3>
 * <table>
 *   <tr><th>Key</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>recorder.locator.prefer.display.name</td><td>false</td><td>Use the display name before the structural path</td></tr>
 *   <tr><td>recorder.locator.allow.structural.path</td><td>true</td><td>Allow {@code Type[idx]/...} locators</td></tr>
 *   <tr><td>recorder.locator.emit.fallback.warnings</td><td>true</td><td>Attach warnings to fallback locators</td></tr>
 *   <tr><td>recorder.text.debounce.millis</td><td>500</td><td>Quiet period that closes a typed-text step</td></tr>
 *   <tr><td>recorder.assert.target.priority</td><td>hover,pointerHitTest,focused</td><td>Where assertion capture looks for its target</td></tr>
 *   <tr><td>recorder.app.id</td><td>App</td><td>Application id in export file names</td></tr>
 *   <tr><td>recorder.scenario.name</td><td>Scenario</td><td>Scenario id in export file and class names</td></tr>
 *   <tr><td>recorder.output.dir</td><td>recorded-tests</td><td>Where {@code save} writes</td></tr>
 *   <tr><td>recorder.codegen.framework</td><td>testng</td><td>testng or junit5</td></tr>
 *   <tr><td>recorder.codegen.package</td><td>recorded</td><td>Package of generated tests</td></tr>
 *   <tr><td>recorder.codegen.base.class</td><td>treeqa.player.RecordedTestBase</td><td>Base class of generated tests</td></tr>
 *   <tr><td>recorder.codegen.include.timestamp</td><td>true</td><td>Append the recording time to the test method name</td></tr>
 *   <tr><td>recorder.hotkey.*</td><td>Ctrl+Shift+R/P/S/A</td><td>start.stop, pause.resume, save, capture.assert</td></tr>
 * </table>
 */
public class RecorderConfig {

    private static final Logger log = LoggerFactory.getLogger(RecorderConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_PREFER_DISPLAY_NAME  = "recorder.locator.prefer.display.name";
    static final String KEY_ALLOW_PATH           = "recorder.locator.allow.structural.path";
    static final String KEY_EMIT_WARNINGS        = "recorder.locator.emit.fallback.warnings";
    static final String KEY_DEBOUNCE_MILLIS      = "recorder.text.debounce.millis";
    static final String KEY_ASSERT_PRIORITY      = "recorder.assert.target.priority";
    static final String KEY_APP_ID               = "recorder.app.id";
    static final String KEY_SCENARIO             = "recorder.scenario.name";
    static final String KEY_OUTPUT_DIR           = "recorder.output.dir";
    static final String KEY_FRAMEWORK            = "recorder.codegen.framework";
    static final String KEY_PACKAGE              = "recorder.codegen.package";
    static final String KEY_BASE_CLASS           = "recorder.codegen.base.class";
    static final String KEY_INCLUDE_TIMESTAMP    = "recorder.codegen.include.timestamp";
    static final String KEY_HOTKEY_START_STOP    = "recorder.hotkey.start.stop";
    static final String KEY_HOTKEY_PAUSE_RESUME  = "recorder.hotkey.pause.resume";
    static final String KEY_HOTKEY_SAVE          = "recorder.hotkey.save";
    static final String KEY_HOTKEY_CAPTURE       = "recorder.hotkey.capture.assert";

    // Defaults
    private static final boolean DEFAULT_PREFER_DISPLAY_NAME = false;
    private static final boolean DEFAULT_ALLOW_PATH          = true;
    private static final boolean DEFAULT_EMIT_WARNINGS       = true;
    private static final int     DEFAULT_DEBOUNCE_MILLIS     = 500;
    private static final String  DEFAULT_ASSERT_PRIORITY     = "hover,pointerHitTest,focused";
    private static final String  DEFAULT_APP_ID              = "App";
    private static final String  DEFAULT_SCENARIO            = "Scenario";
    private static final String  DEFAULT_OUTPUT_DIR          = "recorded-tests";
    private static final String  DEFAULT_FRAMEWORK           = "testng";
    private static final String  DEFAULT_PACKAGE             = "recorded";
    private static final String  DEFAULT_BASE_CLASS          = "treeqa.player.RecordedTestBase";
    private static final boolean DEFAULT_INCLUDE_TIMESTAMP   = true;

    private final Properties props;

    // ── Construction ──────────────────────────────────────────────────────

    /**
     * Loads configuration from the classpath.
     *
     * <p>{@code config.properties} is optional; when absent every setting
     * uses its default. {@code config.local.properties} is optional; if
     * present its values override the base file.
     */
    public RecorderConfig() {
        props = new Properties();
        loadBase();
        loadLocalOverrides();
    }

    /**
     * Package-private constructor for tests: accepts a pre-populated
     * {@link Properties} instance, bypassing classpath I/O.
     */
    RecorderConfig(Properties props) {
        this.props = props;
    }

    /** Creates a config from explicit properties, bypassing the classpath. */
    public static RecorderConfig of(Properties props) {
        return new RecorderConfig(props);
    }

    // ── Locator resolution ────────────────────────────────────────────────

    /** Try the nearest display name before the structural path. Default: {@code false}. */
    public boolean isPreferDisplayNameFallback() {
        return getBool(KEY_PREFER_DISPLAY_NAME, DEFAULT_PREFER_DISPLAY_NAME);
    }

    /** Allow {@code Type[idx]/...} locators. Default: {@code true}. */
    public boolean isAllowStructuralPathFallback() {
        return getBool(KEY_ALLOW_PATH, DEFAULT_ALLOW_PATH);
    }

    /** Attach WARNING/CRITICAL comments to fallback locators. Default: {@code true}. */
    public boolean isEmitFallbackWarnings() {
        return getBool(KEY_EMIT_WARNINGS, DEFAULT_EMIT_WARNINGS);
    }

    // ── Session ───────────────────────────────────────────────────────────

    /** Quiet period after the last character that closes a typed-text step. Default: {@code 500}. */
    public int getTextDebounceMillis() {
        int value = getInt(KEY_DEBOUNCE_MILLIS, DEFAULT_DEBOUNCE_MILLIS);
        if (value < 0) {
            log.warn("Negative value for key '{}': {}, using default {}",
                    KEY_DEBOUNCE_MILLIS, value, DEFAULT_DEBOUNCE_MILLIS);
            return DEFAULT_DEBOUNCE_MILLIS;
        }
        return value;
    }

    /**
     * Order in which assertion capture looks for its target. Unknown names are
     * skipped with a warning; an empty result falls back to the default order.
     */
    public List<AssertTargetSource> getAssertTargetPriority() {
        List<AssertTargetSource> result = parsePriority(props.getProperty(KEY_ASSERT_PRIORITY, DEFAULT_ASSERT_PRIORITY));
        if (result.isEmpty()) {
            log.warn("No usable entries for key '{}', using default {}", KEY_ASSERT_PRIORITY, DEFAULT_ASSERT_PRIORITY);
            return parsePriority(DEFAULT_ASSERT_PRIORITY);
        }
        return result;
    }

    public Hotkey getHotkey(HotkeyCommand command) {
        String key = switch (command) {
            case START_STOP     -> KEY_HOTKEY_START_STOP;
            case PAUSE_RESUME   -> KEY_HOTKEY_PAUSE_RESUME;
            case SAVE           -> KEY_HOTKEY_SAVE;
            case CAPTURE_ASSERT -> KEY_HOTKEY_CAPTURE;
        };
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return command.defaultHotkey();
        try {
            return Hotkey.parse(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid hotkey for key '{}': '{}', using default {}", key, raw, command.defaultHotkey());
            return command.defaultHotkey();
        }
    }

    // ── Export ────────────────────────────────────────────────────────────

    public String getAppId() {
        return getString(KEY_APP_ID, DEFAULT_APP_ID);
    }

    public String getScenarioName() {
        return getString(KEY_SCENARIO, DEFAULT_SCENARIO);
    }

    /** Directory where {@code save} writes generated tests. Default: {@code "recorded-tests"}. */
    public String getOutputDir() {
        return getString(KEY_OUTPUT_DIR, DEFAULT_OUTPUT_DIR);
    }

    public TestFramework getTestFramework() {
        String raw = getString(KEY_FRAMEWORK, DEFAULT_FRAMEWORK);
        try {
            return TestFramework.fromName(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown test framework for key '{}': '{}', using default {}", KEY_FRAMEWORK, raw, DEFAULT_FRAMEWORK);
            return TestFramework.TESTNG;
        }
    }

    public String getCodegenPackage() {
        return getString(KEY_PACKAGE, DEFAULT_PACKAGE);
    }

    public String getCodegenBaseClass() {
        return getString(KEY_BASE_CLASS, DEFAULT_BASE_CLASS);
    }

    public boolean isIncludeTimestamp() {
        return getBool(KEY_INCLUDE_TIMESTAMP, DEFAULT_INCLUDE_TIMESTAMP);
    }

    /** Overrides the display-name fallback at runtime (e.g. from a CLI option). */
    public void setPreferDisplayNameFallback(boolean prefer) {
        props.setProperty(KEY_PREFER_DISPLAY_NAME, String.valueOf(prefer));
    }

    /** Overrides the structural-path fallback at runtime (e.g. from a CLI option). */
    public void setAllowStructuralPathFallback(boolean allow) {
        props.setProperty(KEY_ALLOW_PATH, String.valueOf(allow));
    }

    /** Overrides the scenario name at runtime, e.g. before saving a new recording. */
    public void setScenarioName(String scenario) {
        props.setProperty(KEY_SCENARIO, scenario);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void loadBase() {
        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                log.warn("Classpath resource not found: {}, all recorder settings use defaults", CONFIG_FILE);
                return;
            }
            props.load(base);
            log.debug("Loaded recorder base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }
    }

    private void loadLocalOverrides() {
        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    private String getString(String key, String defaultValue) {
        String raw = props.getProperty(key);
        return raw == null || raw.isBlank() ? defaultValue : raw.trim();
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (v.equals("true")) return true;
        if (v.equals("false")) return false;
        log.warn("Invalid boolean for key '{}': '{}', using default {}", key, raw, defaultValue);
        return defaultValue;
    }

    private static List<AssertTargetSource> parsePriority(String csv) {
        if (csv == null || csv.isBlank()) return Collections.emptyList();
        List<AssertTargetSource> result = new ArrayList<>();
        for (String token : csv.split(",")) {
            String t = token.trim();
            if (t.isEmpty()) continue;
            AssertTargetSource source = AssertTargetSource.fromName(t);
            if (source == null) {
                log.warn("Unknown assertion target source '{}' in {}", t, KEY_ASSERT_PRIORITY);
            } else if (!result.contains(source)) {
                result.add(source);
            }
        }
        return Collections.unmodifiableList(result);
    }
}

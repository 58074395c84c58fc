package treeqa.player;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed replay
 * settings with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code config.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class PlayerConfig {

    private static final Logger log = LoggerFactory.getLogger(PlayerConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    private static final String KEY_WAIT_TIMEOUT = "player.wait.timeout.ms";
    private static final String KEY_WAIT_POLL    = "player.wait.poll.ms";

    // Defaults
    private static final long DEFAULT_WAIT_TIMEOUT = 5000L;
    private static final long DEFAULT_WAIT_POLL    = 50L;

    private final Properties props;

    /**
     * Loads configuration from the classpath. A missing base file is
     * tolerated; every setting then uses its default.
     */
    public PlayerConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                log.warn("Classpath resource not found: {}, all player settings use defaults", CONFIG_FILE);
            } else {
                props.load(base);
                log.debug("Loaded base config from {}", CONFIG_FILE);
            }
        } catch (IOException e) {
            throw new TreeQAException("Cannot load " + CONFIG_FILE, e);
        }

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

    /**
     * Package-private constructor for tests; accepts an already-populated
     * {@link Properties} instance.
     */
    PlayerConfig(Properties props) {
        this.props = props;
    }

    /** Creates a config from explicit properties, bypassing the classpath. */
    public static PlayerConfig of(Properties props) {
        return new PlayerConfig(props);
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** How long {@code waitFor*} keeps polling before failing (default: 5000). */
    public long getWaitTimeoutMs() {
        return getPositiveLong(KEY_WAIT_TIMEOUT, DEFAULT_WAIT_TIMEOUT);
    }

    /** Delay between two polls of a wait condition (default: 50). */
    public long getWaitPollMs() {
        return getPositiveLong(KEY_WAIT_POLL, DEFAULT_WAIT_POLL);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private long getPositiveLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            long value = Long.parseLong(raw.trim());
            if (value > 0) return value;
        } catch (NumberFormatException e) {
            log.debug("Unparsable value for key '{}': {}", key, e.getMessage());
        }
        log.warn("Invalid value for key '{}': '{}', using default {}", key, raw, defaultValue);
        return defaultValue;
    }
}

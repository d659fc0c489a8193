package autoexplore.explorer;

import autoexplore.model.ScreenGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Reads {@code config.properties} from the classpath and exposes typed
 * engine settings with defaults.
 *
 * <p>Any value can be overridden by a {@code config.local.properties} file on
 * the classpath (not committed to VCS). Values that do not parse are logged
 * and replaced by their default.
 */
public class ExplorerConfig {

    private static final Logger log = LoggerFactory.getLogger(ExplorerConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_SCREEN_WIDTH      = "explorer.screen.width";
    static final String KEY_SCREEN_HEIGHT     = "explorer.screen.height";
    static final String KEY_STATUS_BAR        = "explorer.status.bar.height";
    static final String KEY_NAV_BAR           = "explorer.nav.bar.height";
    static final String KEY_CAPTURE_RETRIES   = "explorer.capture.retries";
    static final String KEY_CAPTURE_BACKOFF   = "explorer.capture.backoff.ms";
    static final String KEY_STUCK_THRESHOLD   = "explorer.stuck.threshold";
    static final String KEY_RESTART_THRESHOLD = "explorer.restart.threshold";
    static final String KEY_PLATEAU_MS        = "explorer.plateau.ms";
    static final String KEY_REROUTE_ATTEMPTS  = "explorer.max.reroute.attempts";
    static final String KEY_ELEMENT_RETRIES   = "explorer.max.element.retries";
    static final String KEY_HELP_WAIT         = "explorer.help.wait.ms";
    static final String KEY_ADAPTIVE_QUOTA    = "explorer.adaptive.quota";
    static final String KEY_ADAPTIVE_STAGNATE = "explorer.adaptive.stagnation";
    static final String KEY_POLICY_STORE      = "explorer.policy.store";
    static final String KEY_STRATEGY_STORE    = "explorer.strategy.store";

    // Defaults
    private static final int    DEFAULT_CAPTURE_RETRIES   = 3;
    private static final long   DEFAULT_CAPTURE_BACKOFF   = 250L;
    private static final int    DEFAULT_STUCK_THRESHOLD   = 5;
    private static final int    DEFAULT_RESTART_THRESHOLD = 15;
    private static final long   DEFAULT_PLATEAU_MS        = 120_000L;
    private static final int    DEFAULT_REROUTE_ATTEMPTS  = 3;
    private static final int    DEFAULT_ELEMENT_RETRIES   = 2;
    private static final long   DEFAULT_HELP_WAIT         = 30_000L;
    private static final int    DEFAULT_ADAPTIVE_QUOTA    = 15;
    private static final int    DEFAULT_ADAPTIVE_STAGNATE = 6;
    private static final String DEFAULT_POLICY_STORE      = "policy-store.json";
    private static final String DEFAULT_STRATEGY_STORE    = "strategy-memory.json";

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     *
     * @throws ExplorationException if {@code config.properties} is missing or unreadable
     */
    public ExplorerConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new ExplorationException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /** For tests: wraps an already-populated {@link Properties}. */
    ExplorerConfig(Properties props) {
        this.props = props;
    }

    // ── Device ────────────────────────────────────────────────────────────

    public ScreenGeometry getScreenGeometry() {
        ScreenGeometry d = ScreenGeometry.DEFAULT;
        return new ScreenGeometry(
                getInt(KEY_SCREEN_WIDTH, d.width()),
                getInt(KEY_SCREEN_HEIGHT, d.height()),
                getInt(KEY_STATUS_BAR, d.statusBarHeight()),
                getInt(KEY_NAV_BAR, d.navBarHeight()));
    }

    /** Capture attempts before a capture failure is escalated (default: 3). */
    public int getCaptureRetries() {
        return getInt(KEY_CAPTURE_RETRIES, DEFAULT_CAPTURE_RETRIES);
    }

    /** Base of the linear backoff between capture attempts (default: 250 ms). */
    public long getCaptureBackoffMs() {
        return getLong(KEY_CAPTURE_BACKOFF, DEFAULT_CAPTURE_BACKOFF);
    }

    // ── Staleness and recovery ────────────────────────────────────────────

    /** No-effect actions on one screen before the run counts as stuck (default: 5). */
    public int getStuckThreshold() {
        return getInt(KEY_STUCK_THRESHOLD, DEFAULT_STUCK_THRESHOLD);
    }

    /** Actions without any discovery before recovery jumps straight to a restart (default: 15). */
    public int getRestartThreshold() {
        return getInt(KEY_RESTART_THRESHOLD, DEFAULT_RESTART_THRESHOLD);
    }

    public long getPlateauMs() {
        return getLong(KEY_PLATEAU_MS, DEFAULT_PLATEAU_MS);
    }

    public int getMaxRerouteAttempts() {
        return getInt(KEY_REROUTE_ATTEMPTS, DEFAULT_REROUTE_ATTEMPTS);
    }

    /** Transient failures tolerated per element before it is reported stuck (default: 2). */
    public int getMaxElementRetries() {
        return getInt(KEY_ELEMENT_RETRIES, DEFAULT_ELEMENT_RETRIES);
    }

    public long getHelpWaitMs() {
        return getLong(KEY_HELP_WAIT, DEFAULT_HELP_WAIT);
    }

    // ── Adaptive strategy ─────────────────────────────────────────────────

    /** Actions an adaptive run gives one strategy before rotating (default: 15). */
    public int getAdaptiveQuota() {
        return getInt(KEY_ADAPTIVE_QUOTA, DEFAULT_ADAPTIVE_QUOTA);
    }

    /** Actions without discovery after which an adaptive run rotates early (default: 6). */
    public int getAdaptiveStagnation() {
        return getInt(KEY_ADAPTIVE_STAGNATE, DEFAULT_ADAPTIVE_STAGNATE);
    }

    // ── Files ─────────────────────────────────────────────────────────────

    public Path getPolicyStorePath() {
        return Path.of(props.getProperty(KEY_POLICY_STORE, DEFAULT_POLICY_STORE).trim());
    }

    public Path getStrategyStorePath() {
        return Path.of(props.getProperty(KEY_STRATEGY_STORE, DEFAULT_STRATEGY_STORE).trim());
    }

    /** Effective key/value pairs under {@code explorer.}, sorted. */
    public Map<String, String> asMap() {
        Map<String, String> out = new TreeMap<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith("explorer.")) out.put(key, props.getProperty(key).trim());
        }
        return out;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

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

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}

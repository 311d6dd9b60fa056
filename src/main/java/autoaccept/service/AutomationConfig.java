package autoaccept.service;

import autoaccept.flow.FlowSettings;
import autoaccept.model.AutoAcceptException;
import autoaccept.model.ChangeKind;
import autoaccept.model.TargetCatalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Reads {@code autoaccept.properties} from the classpath and exposes typed
 * service configuration values with sensible defaults.
 *
 * <p>All values can be overridden by placing an
 * {@code autoaccept.local.properties} file on the classpath (higher priority,
 * not committed to VCS).
 */
public class AutomationConfig {

    private static final Logger log = LoggerFactory.getLogger(AutomationConfig.class);

    private static final String CONFIG_FILE       = "autoaccept.properties";
    private static final String CONFIG_LOCAL_FILE = "autoaccept.local.properties";

    // Property keys
    private static final String KEY_SOURCE_PACKAGE       = "service.source.package";
    private static final String KEY_COMPANION_PACKAGE    = "service.companion.package";
    private static final String KEY_TRIGGER_KINDS        = "service.trigger.kinds";
    private static final String KEY_NOTIFICATION_TIMEOUT = "service.notification.timeout.ms";
    private static final String KEY_MIN_INTERVAL         = "gate.min.interval.ms";
    private static final String KEY_SETTLE_DELAY         = "gate.settle.delay.ms";
    private static final String KEY_SOURCE_RENDER        = "cycle.render.delay.source.ms";
    private static final String KEY_COMPANION_RENDER     = "cycle.render.delay.companion.ms";
    private static final String KEY_STUCK_TIMEOUT        = "flow.stuck.timeout.ms";
    private static final String KEY_RECHECK_DELAY        = "flow.recheck.delay.ms";
    private static final String KEY_CHOOSER_RECHECK      = "flow.recheck.after.chooser.ms";
    private static final String KEY_CONFIRM_RETRY        = "flow.confirm.retry.ms";
    private static final String KEY_SELECTION_PHRASE     = "flow.selection.phrase";
    private static final String KEY_FOCUS_SETTLE         = "action.focus.settle.ms";
    private static final String KEY_ALT_FOCUS_SETTLE     = "action.alt.focus.settle.ms";
    private static final String KEY_CATALOG_RESOURCE     = "catalog.resource";
    private static final String KEY_CATALOG_FILE         = "catalog.file";

    // Defaults
    private static final String DEFAULT_SOURCE_PACKAGE       = "com.anydesk.anydeskandroid";
    private static final String DEFAULT_COMPANION_PACKAGE    = "com.android.systemui";
    private static final Set<ChangeKind> DEFAULT_TRIGGER_KINDS = EnumSet.of(ChangeKind.WINDOW_STATE_CHANGED);
    private static final long   DEFAULT_NOTIFICATION_TIMEOUT = 100L;
    private static final long   DEFAULT_MIN_INTERVAL         = 800L;
    private static final long   DEFAULT_SETTLE_DELAY         = 400L;
    private static final long   DEFAULT_SOURCE_RENDER        = 300L;
    private static final long   DEFAULT_COMPANION_RENDER     = 500L;
    private static final long   DEFAULT_STUCK_TIMEOUT        = 30_000L;
    private static final long   DEFAULT_RECHECK_DELAY        = 500L;
    private static final long   DEFAULT_CHOOSER_RECHECK      = 800L;
    private static final long   DEFAULT_CONFIRM_RETRY        = 1_000L;
    private static final String DEFAULT_SELECTION_PHRASE     = "entire screen";
    private static final long   DEFAULT_FOCUS_SETTLE         = 50L;
    private static final long   DEFAULT_ALT_FOCUS_SETTLE     = 100L;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code autoaccept.local.properties} values override {@code autoaccept.properties}.
     *
     * @throws AutoAcceptException if the base autoaccept.properties cannot be loaded
     */
    public AutomationConfig() {
        props = new Properties();
        loadInto(props, CONFIG_FILE, true);
        loadInto(props, CONFIG_LOCAL_FILE, false);
    }

    /**
     * Layers one classpath properties file onto {@code target}. A missing or
     * unreadable required file is fatal; an optional one is skipped.
     */
    private static void loadInto(Properties target, String resource, boolean required) {
        try (InputStream in = AutomationConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                if (required) {
                    throw new AutoAcceptException("Classpath resource not found: " + resource);
                }
                return;
            }
            target.load(in);
            log.debug("Loaded {} ({} keys so far)", resource, target.size());
        } catch (IOException e) {
            if (required) {
                throw new AutoAcceptException("Cannot load " + resource, e);
            }
            log.warn("Failed to read {}; keeping the values loaded so far: {}", resource, e.getMessage());
        }
    }

    /** Package-private constructor for tests. */
    AutomationConfig(Properties props) {
        this.props = props;
    }

    // ── Monitored applications ────────────────────────────────────────────

    /** Application whose incoming-connection dialog starts a flow. */
    public String getSourcePackage() {
        return getString(KEY_SOURCE_PACKAGE, DEFAULT_SOURCE_PACKAGE);
    }

    /** Application that shows the screen-share permission dialogs. */
    public String getCompanionPackage() {
        return getString(KEY_COMPANION_PACKAGE, DEFAULT_COMPANION_PACKAGE);
    }

    /**
     * Notification kinds that may start a cycle, comma-separated
     * (default: WINDOW_STATE_CHANGED). Unknown names are skipped with a warning.
     */
    public Set<ChangeKind> getTriggerKinds() {
        String raw = props.getProperty(KEY_TRIGGER_KINDS);
        if (raw == null || raw.isBlank()) return EnumSet.copyOf(DEFAULT_TRIGGER_KINDS);

        Set<ChangeKind> kinds = EnumSet.noneOf(ChangeKind.class);
        for (String token : raw.split(",")) {
            String name = token.trim().toUpperCase(Locale.ROOT);
            if (name.isEmpty()) continue;
            try {
                kinds.add(ChangeKind.valueOf(name));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown change kind '{}' in '{}'; skipped", token.trim(), KEY_TRIGGER_KINDS);
            }
        }
        if (kinds.isEmpty()) {
            log.warn("No valid change kinds in '{}'; using default {}", KEY_TRIGGER_KINDS, DEFAULT_TRIGGER_KINDS);
            return EnumSet.copyOf(DEFAULT_TRIGGER_KINDS);
        }
        return kinds;
    }

    /** Platform-side coalescing window for notifications (default: 100). */
    public long getNotificationTimeoutMs() {
        return getLong(KEY_NOTIFICATION_TIMEOUT, DEFAULT_NOTIFICATION_TIMEOUT);
    }

    // ── Gate / cycle timing ──────────────────────────────────────────────

    /** Minimum gap between accepted notifications (default: 800). */
    public long getMinIntervalMs() {
        return getLong(KEY_MIN_INTERVAL, DEFAULT_MIN_INTERVAL);
    }

    /** Delay between an accepted notification and its cycle (default: 400). */
    public long getSettleDelayMs() {
        return getLong(KEY_SETTLE_DELAY, DEFAULT_SETTLE_DELAY);
    }

    public long getSourceRenderDelayMs() {
        return getLong(KEY_SOURCE_RENDER, DEFAULT_SOURCE_RENDER);
    }

    public long getCompanionRenderDelayMs() {
        return getLong(KEY_COMPANION_RENDER, DEFAULT_COMPANION_RENDER);
    }

    // ── Flow ──────────────────────────────────────────────────────────────

    /** No-progress window after which a flow falls back to idle (default: 30000). */
    public long getStuckTimeoutMs() {
        return getLong(KEY_STUCK_TIMEOUT, DEFAULT_STUCK_TIMEOUT);
    }

    public long getRecheckDelayMs() {
        return getLong(KEY_RECHECK_DELAY, DEFAULT_RECHECK_DELAY);
    }

    public long getChooserRecheckMs() {
        return getLong(KEY_CHOOSER_RECHECK, DEFAULT_CHOOSER_RECHECK);
    }

    public long getConfirmRetryMs() {
        return getLong(KEY_CONFIRM_RETRY, DEFAULT_CONFIRM_RETRY);
    }

    /** Text the share-mode selector must show before confirming (default: "entire screen"). */
    public String getSelectionPhrase() {
        return getString(KEY_SELECTION_PHRASE, DEFAULT_SELECTION_PHRASE);
    }

    public FlowSettings flowSettings() {
        return new FlowSettings(Duration.ofMillis(getStuckTimeoutMs()), getRecheckDelayMs(),
                getChooserRecheckMs(), getConfirmRetryMs(), getSelectionPhrase());
    }

    // ── Actions ───────────────────────────────────────────────────────────

    /** Pause between focusing a node and clicking it (default: 50). */
    public long getFocusSettleMs() {
        return getLong(KEY_FOCUS_SETTLE, DEFAULT_FOCUS_SETTLE);
    }

    /** Pause after input focus in the escalated click path (default: 100). */
    public long getAltFocusSettleMs() {
        return getLong(KEY_ALT_FOCUS_SETTLE, DEFAULT_ALT_FOCUS_SETTLE);
    }

    // ── Target catalog ───────────────────────────────────────────────────

    public String getCatalogResource() {
        return getString(KEY_CATALOG_RESOURCE, TargetCatalog.DEFAULT_RESOURCE);
    }

    /** Optional external catalog merged over the classpath one; null when unset. */
    public Path getCatalogFile() {
        String raw = props.getProperty(KEY_CATALOG_FILE);
        return (raw == null || raw.isBlank()) ? null : Path.of(raw.trim());
    }

    /**
     * Loads the classpath catalog, merges the external catalog file if one is
     * configured, and validates the result.
     *
     * @throws AutoAcceptException if a catalog is missing, malformed or inconsistent
     */
    public TargetCatalog loadCatalog() {
        TargetCatalog catalog = TargetCatalog.fromClasspath(getCatalogResource());
        Path external = getCatalogFile();
        if (external != null) {
            if (!Files.isRegularFile(external)) {
                throw new AutoAcceptException("Catalog file not found: " + external);
            }
            try {
                int merged = catalog.merge(TargetCatalog.load(external));
                log.info("Merged {} catalog entries from {}", merged, external);
            } catch (IOException e) {
                throw new AutoAcceptException("Cannot parse catalog file " + external, e);
            }
        }
        return catalog.validate();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String getString(String key, String defaultValue) {
        String raw = props.getProperty(key);
        return (raw == null || raw.isBlank()) ? defaultValue : raw.trim();
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            long value = Long.parseLong(raw.trim());
            if (value < 0) {
                log.warn("Negative value for key '{}': '{}'; using default {}", key, raw, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}

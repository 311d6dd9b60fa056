package autoaccept.service;

import autoaccept.flow.FlowSettings;
import autoaccept.model.AutoAcceptException;
import autoaccept.model.ChangeKind;
import autoaccept.model.TargetCatalog;

import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AutomationConfig}.
 *
 * <p>Most tests use the package-private {@code AutomationConfig(Properties)}
 * constructor to avoid classpath file I/O.
 */
public class AutomationConfigTest {

    // ── Defaults ──────────────────────────────────────────────────────────

    @Test(description = "All accessors return documented defaults when properties are empty")
    public void testAllDefaults() {
        AutomationConfig cfg = new AutomationConfig(new Properties());

        assertThat(cfg.getSourcePackage()).isEqualTo("com.anydesk.anydeskandroid");
        assertThat(cfg.getCompanionPackage()).isEqualTo("com.android.systemui");
        assertThat(cfg.getTriggerKinds()).containsExactly(ChangeKind.WINDOW_STATE_CHANGED);
        assertThat(cfg.getNotificationTimeoutMs()).isEqualTo(100L);
        assertThat(cfg.getMinIntervalMs()).isEqualTo(800L);
        assertThat(cfg.getSettleDelayMs()).isEqualTo(400L);
        assertThat(cfg.getSourceRenderDelayMs()).isEqualTo(300L);
        assertThat(cfg.getCompanionRenderDelayMs()).isEqualTo(500L);
        assertThat(cfg.getFocusSettleMs()).isEqualTo(50L);
        assertThat(cfg.getAltFocusSettleMs()).isEqualTo(100L);
        assertThat(cfg.getCatalogResource()).isEqualTo("ui-targets.json");
        assertThat(cfg.getCatalogFile()).isNull();
    }

    @Test
    public void defaultFlowSettingsMatchBuiltIns() {
        assertThat(new AutomationConfig(new Properties()).flowSettings()).isEqualTo(FlowSettings.defaults());
    }

    @Test(description = "The bundled autoaccept.properties loads and agrees with the defaults")
    public void testClasspathConfig() {
        AutomationConfig cfg = new AutomationConfig();

        assertThat(cfg.getSourcePackage()).isEqualTo("com.anydesk.anydeskandroid");
        assertThat(cfg.getStuckTimeoutMs()).isEqualTo(30_000L);
        assertThat(cfg.getSelectionPhrase()).isEqualTo("entire screen");
    }

    // ── Overrides ─────────────────────────────────────────────────────────

    @Test
    public void testOverrides() {
        Properties p = new Properties();
        p.setProperty("service.source.package", " com.example.remote ");
        p.setProperty("gate.min.interval.ms", "250");
        p.setProperty("flow.stuck.timeout.ms", "5000");
        p.setProperty("flow.selection.phrase", "whole screen");

        AutomationConfig cfg = new AutomationConfig(p);

        assertThat(cfg.getSourcePackage()).isEqualTo("com.example.remote");
        assertThat(cfg.getMinIntervalMs()).isEqualTo(250L);
        assertThat(cfg.flowSettings().stuckTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cfg.flowSettings().selectionPhrase()).isEqualTo("whole screen");
    }

    @Test(description = "Invalid or negative numbers fall back to the default")
    public void testInvalidNumbersFallBack() {
        Properties p = new Properties();
        p.setProperty("gate.settle.delay.ms", "soon");
        p.setProperty("flow.confirm.retry.ms", "-5");

        AutomationConfig cfg = new AutomationConfig(p);

        assertThat(cfg.getSettleDelayMs()).isEqualTo(400L);
        assertThat(cfg.getConfirmRetryMs()).isEqualTo(1000L);
    }

    @Test
    public void testTriggerKindsParsing() {
        Properties p = new Properties();
        p.setProperty("service.trigger.kinds", "window_state_changed, WINDOW_CONTENT_CHANGED, BOGUS");

        assertThat(new AutomationConfig(p).getTriggerKinds())
                .containsExactlyInAnyOrder(ChangeKind.WINDOW_STATE_CHANGED, ChangeKind.WINDOW_CONTENT_CHANGED);

        p.setProperty("service.trigger.kinds", "BOGUS");
        assertThat(new AutomationConfig(p).getTriggerKinds()).containsExactly(ChangeKind.WINDOW_STATE_CHANGED);
    }

    // ── Catalog ───────────────────────────────────────────────────────────

    @Test
    public void loadsBundledCatalog() {
        TargetCatalog catalog = new AutomationConfig(new Properties()).loadCatalog();

        assertThat(catalog.hasTarget("confirm-button")).isTrue();
    }

    @Test(description = "An external catalog file is merged over the bundled one")
    public void mergesExternalCatalog() throws IOException {
        Path file = Files.createTempFile("override", ".json");
        try {
            Files.writeString(file, "{ \"targets\": { \"confirm-button\": { \"escalate\": false, \"matchers\": ["
                    + "{ \"kind\": \"TEXT\", \"value\": \"Jetzt starten\", \"clickable\": true } ] } } }");
            Properties p = new Properties();
            p.setProperty("catalog.file", file.toString());

            TargetCatalog catalog = new AutomationConfig(p).loadCatalog();

            assertThat(catalog.target("confirm-button").isEscalate()).isFalse();
            assertThat(catalog.target("confirm-button").getMatchers().get(0).getValue()).isEqualTo("Jetzt starten");
            assertThat(catalog.hasTarget("accept-button")).isTrue();
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    public void missingExternalCatalogFails() {
        Properties p = new Properties();
        p.setProperty("catalog.file", "/nonexistent/ui-targets.json");

        assertThatThrownBy(() -> new AutomationConfig(p).loadCatalog())
                .isInstanceOf(AutoAcceptException.class)
                .hasMessageContaining("/nonexistent/ui-targets.json");
    }

    @Test(description = "An override whose matcher has no kind fails at load time")
    public void invalidExternalCatalogFails() throws IOException {
        Path file = Files.createTempFile("invalid", ".json");
        try {
            Files.writeString(file, "{ \"targets\": { \"confirm-button\": { \"escalate\": true, \"matchers\": ["
                    + "{ \"value\": \"Start now\" } ] } } }");
            Properties p = new Properties();
            p.setProperty("catalog.file", file.toString());

            assertThatThrownBy(() -> new AutomationConfig(p).loadCatalog())
                    .isInstanceOf(AutoAcceptException.class)
                    .hasMessageContaining("confirm-button")
                    .hasMessageContaining("has no kind");
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    public void malformedExternalCatalogFails() throws IOException {
        Path file = Files.createTempFile("broken", ".json");
        try {
            Files.writeString(file, "{ not json");
            Properties p = new Properties();
            p.setProperty("catalog.file", file.toString());

            assertThatThrownBy(() -> new AutomationConfig(p).loadCatalog())
                    .isInstanceOf(AutoAcceptException.class)
                    .hasCauseInstanceOf(IOException.class);
        } finally {
            Files.deleteIfExists(file);
        }
    }
}

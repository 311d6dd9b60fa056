package autoaccept.service;

import autoaccept.action.ClickExecutor;
import autoaccept.detect.DialogDetector;
import autoaccept.flow.FlowState;
import autoaccept.flow.FlowStateMachine;
import autoaccept.flow.FlowStats;
import autoaccept.gate.CycleRunner;
import autoaccept.gate.DeferredTaskScheduler;
import autoaccept.gate.EventGate;
import autoaccept.gate.TaskScheduler;
import autoaccept.locator.NodeLocator;
import autoaccept.model.AppRole;
import autoaccept.model.ChangeEvent;
import autoaccept.model.FlowStep;
import autoaccept.model.TargetCatalog;
import autoaccept.platform.EventSubscription;
import autoaccept.platform.NodeAccess;
import autoaccept.platform.NotificationSink;
import autoaccept.platform.UiPlatform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Service entry point: owns the session state, wires the pipeline and maps the
 * host's lifecycle callbacks onto it.
 *
 * <pre>
 *   onChange ─▶ EventGate ─▶ (settle) ─▶ CycleRunner ─▶ FlowStateMachine
 * </pre>
 *
 * <p>Change notifications are ignored until {@link #onServiceConnected()} and
 * after any teardown hook. Every teardown cancels pending deferred tasks, ends
 * the session so a cycle still in flight can neither advance the flow nor
 * schedule a re-check, drops flow progress and logs the statistics;
 * {@link #onDestroy()} additionally stops the background threads.
 */
public class AutomationService {

    private static final Logger log = LoggerFactory.getLogger(AutomationService.class);

    private final UiPlatform platform;
    private final AutomationConfig config;
    private final TaskScheduler scheduler;
    private final ExecutorService worker;
    private final Clock clock;
    private final EventGate gate;

    private volatile FlowState state;
    private volatile boolean enabled;

    /**
     * Creates a service with its own scheduler and worker threads and the
     * catalog the configuration points at.
     *
     * @throws autoaccept.model.AutoAcceptException if the catalog cannot be loaded
     */
    public AutomationService(UiPlatform platform, AutomationConfig config, NotificationSink sink) {
        this(platform, config, sink,
                new DeferredTaskScheduler("autoaccept-scheduler"),
                Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "autoaccept-cycle");
                    t.setDaemon(true);
                    return t;
                }),
                Clock.systemUTC(),
                config.loadCatalog());
    }

    /** Package-private constructor for tests that control time and threads. */
    AutomationService(UiPlatform platform, AutomationConfig config, NotificationSink sink,
                      TaskScheduler scheduler, ExecutorService worker, Clock clock,
                      TargetCatalog catalog) {
        this.platform  = platform;
        this.config    = config;
        this.scheduler = scheduler;
        this.worker    = worker;
        this.clock     = clock;

        NodeLocator locator = new NodeLocator(catalog);
        FlowStateMachine machine = new FlowStateMachine(
                new DialogDetector(catalog, locator),
                locator,
                new ClickExecutor(config.getFocusSettleMs(), config.getAltFocusSettleMs()),
                sink,
                config.flowSettings(),
                clock);
        CycleRunner runner = new CycleRunner(new NodeAccess(platform), machine, scheduler, worker,
                config.getSourceRenderDelayMs(), config.getCompanionRenderDelayMs());
        this.gate = new EventGate(monitoredApplications(config), config.getTriggerKinds(),
                config.getMinIntervalMs(), config.getSettleDelayMs(), scheduler, runner, clock);
    }

    // ── Lifecycle ────────────────────────────────────────────────────────

    public void onServiceConnected() {
        state = FlowState.start(clock.instant());
        enabled = true;
        EventSubscription subscription = subscription();
        platform.configure(subscription);
        log.info("Service connected; watching {} for {}", subscription.packageNames(), subscription.kinds());
    }

    public void onInterrupt() {
        teardown("interrupted");
    }

    public void onUnbind() {
        teardown("unbound");
    }

    public void onDestroy() {
        teardown("destroyed");
        scheduler.shutdown();
        worker.shutdownNow();
    }

    private void teardown(String reason) {
        enabled = false;
        scheduler.cancelAll();
        FlowState current = state;
        if (current != null) {
            current.teardown(clock.instant());
            log.info("Service {}; {}", reason, current.stats(false));
        } else {
            log.info("Service {} before it was connected", reason);
        }
    }

    // ── Input ────────────────────────────────────────────────────────────

    /**
     * Offers a UI change notification. Never blocks.
     *
     * @return true if the notification scheduled a processing cycle
     */
    public boolean onChange(ChangeEvent event) {
        FlowState current = state;
        if (!enabled || current == null) {
            log.trace("Service disabled; ignoring {}", event);
            return false;
        }
        return gate.onChange(current, event);
    }

    // ── Status ───────────────────────────────────────────────────────────

    public boolean isServiceEnabled() {
        return enabled;
    }

    public FlowStats stats() {
        FlowState current = state;
        return current == null
                ? new FlowStats(FlowStep.IDLE, 0, 0, 0, false, enabled)
                : current.stats(enabled);
    }

    /** What this service asks the platform to deliver. */
    public EventSubscription subscription() {
        return new EventSubscription(monitoredApplications(config).keySet(), config.getTriggerKinds(),
                config.getNotificationTimeoutMs(), true);
    }

    private static Map<String, AppRole> monitoredApplications(AutomationConfig config) {
        Map<String, AppRole> monitored = new LinkedHashMap<>();
        monitored.put(config.getSourcePackage(), AppRole.SOURCE);
        if (monitored.putIfAbsent(config.getCompanionPackage(), AppRole.COMPANION) != null) {
            log.warn("Companion package equals source package '{}'; treating it as source only",
                    config.getSourcePackage());
        }
        return monitored;
    }
}

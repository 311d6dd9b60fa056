package autoaccept.gate;

import autoaccept.flow.FlowState;
import autoaccept.model.AppRole;
import autoaccept.model.ChangeEvent;
import autoaccept.model.ChangeKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Filters and rate-limits UI change notifications before they reach the
 * {@link CycleRunner}.
 *
 * <p>A notification is dropped when it comes from an unmonitored application,
 * when its kind is not a trigger kind, or when it arrives within the minimum
 * interval of the last accepted one. An accepted notification cancels any
 * pending re-check and (re)schedules the settle task, so of several accepted
 * notifications inside one settle window only the last one starts a cycle.
 *
 * <p>Called only from the platform's single notification thread.
 */
public class EventGate {

    private static final Logger log = LoggerFactory.getLogger(EventGate.class);

    private final Map<String, AppRole> monitored;
    private final Set<ChangeKind> triggerKinds;
    private final long minIntervalMs;
    private final long settleDelayMs;
    private final TaskScheduler scheduler;
    private final CycleRunner runner;
    private final Clock clock;

    private long lastAcceptedAtMs;
    private boolean anyAccepted;

    /**
     * @param monitored     application identifier to role
     * @param triggerKinds  notification kinds that may start a cycle
     * @param minIntervalMs notifications closer than this to the last accepted one are dropped
     * @param settleDelayMs delay between an accepted notification and its cycle
     */
    public EventGate(Map<String, AppRole> monitored, Set<ChangeKind> triggerKinds,
                     long minIntervalMs, long settleDelayMs,
                     TaskScheduler scheduler, CycleRunner runner, Clock clock) {
        this.monitored     = Map.copyOf(monitored);
        this.triggerKinds  = Set.copyOf(triggerKinds);
        this.minIntervalMs = minIntervalMs;
        this.settleDelayMs = settleDelayMs;
        this.scheduler     = scheduler;
        this.runner        = runner;
        this.clock         = clock;
    }

    /**
     * Offers one notification to the gate.
     *
     * @return true if a settle task was scheduled for it
     */
    public boolean onChange(FlowState state, ChangeEvent event) {
        Optional<AppRole> app = roleOf(event.sourceApplicationId());
        if (app.isEmpty()) {
            log.trace("Ignoring notification from unmonitored '{}'", event.sourceApplicationId());
            return false;
        }
        if (!triggerKinds.contains(event.kind())) {
            log.trace("Ignoring {} from {}", event.kind(), app.get());
            return false;
        }

        long now = clock.millis();
        if (anyAccepted && now - lastAcceptedAtMs < minIntervalMs) {
            log.debug("Rate limited {} from {} ({} ms since last)", event.kind(), app.get(), now - lastAcceptedAtMs);
            return false;
        }
        anyAccepted = true;
        lastAcceptedAtMs = now;

        AppRole role = app.get();
        scheduler.cancel(TaskPurpose.RETRY);
        scheduler.schedule(TaskPurpose.SETTLE, settleDelayMs, () -> runner.trigger(state, role));
        log.debug("{} from {} accepted; cycle in {} ms", event.kind(), role, settleDelayMs);
        return true;
    }

    public Optional<AppRole> roleOf(String applicationId) {
        return applicationId == null ? Optional.empty() : Optional.ofNullable(monitored.get(applicationId));
    }
}

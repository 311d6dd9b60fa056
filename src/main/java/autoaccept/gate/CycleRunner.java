package autoaccept.gate;

import autoaccept.flow.CycleOutcome;
import autoaccept.flow.FlowState;
import autoaccept.flow.FlowStateMachine;
import autoaccept.model.AppRole;
import autoaccept.platform.NodeAccess;
import autoaccept.platform.Snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs processing cycles on a background worker, one at a time.
 *
 * <p>{@link #trigger} is a non-blocking try-lock on
 * {@link FlowState#tryBeginProcessing()}: when a cycle is already in flight the
 * trigger is dropped, not queued. A transition that happens during a running
 * cycle is therefore only seen on the next notification or on a requested
 * re-check.
 *
 * <p>Every cycle acquires its own snapshot and closes it on every exit path;
 * any runtime fault ends the cycle, is logged, and leaves the flow step as it
 * was. Once the session is torn down no cycle or re-check is started for it.
 */
public class CycleRunner {

    private static final Logger log = LoggerFactory.getLogger(CycleRunner.class);

    private final NodeAccess access;
    private final FlowStateMachine machine;
    private final TaskScheduler scheduler;
    private final Executor worker;
    private final long sourceRenderDelayMs;
    private final long companionRenderDelayMs;

    /**
     * @param access                 snapshot source
     * @param machine                state machine run inside each cycle
     * @param scheduler              used for follow-up checks the machine asks for
     * @param worker                 background execution context for cycles
     * @param sourceRenderDelayMs    wait before reading a source-application window
     * @param companionRenderDelayMs wait before reading a companion-application window
     */
    public CycleRunner(NodeAccess access, FlowStateMachine machine, TaskScheduler scheduler,
                       Executor worker, long sourceRenderDelayMs, long companionRenderDelayMs) {
        this.access                 = access;
        this.machine                = machine;
        this.scheduler              = scheduler;
        this.worker                 = worker;
        this.sourceRenderDelayMs    = sourceRenderDelayMs;
        this.companionRenderDelayMs = companionRenderDelayMs;
    }

    /**
     * Starts a cycle for a window of {@code app} unless one is already running.
     *
     * @return true if a cycle was handed to the worker
     */
    public boolean trigger(FlowState state, AppRole app) {
        if (!state.isActive()) {
            log.debug("Session ended; dropping {} trigger", app);
            return false;
        }
        if (!state.tryBeginProcessing()) {
            log.debug("Cycle already in flight; dropping {} trigger", app);
            return false;
        }
        try {
            worker.execute(() -> runCycle(state, app));
            return true;
        } catch (RejectedExecutionException e) {
            state.endProcessing();
            log.warn("Cycle worker rejected {} trigger: {}", app, e.getMessage());
            return false;
        }
    }

    // ── Cycle body ────────────────────────────────────────────────────────

    void runCycle(FlowState state, AppRole app) {
        try {
            pause(app == AppRole.SOURCE ? sourceRenderDelayMs : companionRenderDelayMs);
            if (!state.isActive()) {
                log.debug("Session ended before the {} cycle read the window", app);
                return;
            }

            Optional<Snapshot> acquired = access.acquireSnapshot();
            if (acquired.isEmpty()) {
                log.debug("No active window for {} cycle", app);
                return;
            }
            try (Snapshot snapshot = acquired.get()) {
                CycleOutcome outcome = machine.process(state, snapshot, app);
                log.debug("{} cycle: {} at step {}", app, outcome.result(), outcome.step());
                if (outcome.wantsRecheck() && state.isActive()) {
                    scheduleRecheck(state, app, outcome);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("{} cycle interrupted", app);
        } catch (RuntimeException e) {
            log.error("{} cycle aborted by a UI query fault; waiting for the next notification", app, e);
        } finally {
            state.endProcessing();
        }
    }

    private void scheduleRecheck(FlowState state, AppRole app, CycleOutcome outcome) {
        log.debug("Re-check of {} window in {} ms", app, outcome.recheckAfterMs());
        scheduler.schedule(TaskPurpose.RETRY, outcome.recheckAfterMs(), () -> {
            if (!state.isActive()) {
                log.debug("Skipping re-check: session ended");
            } else if (state.step() == outcome.recheckOnlyAt()) {
                trigger(state, app);
            } else {
                log.debug("Skipping re-check: step moved from {} to {}", outcome.recheckOnlyAt(), state.step());
            }
        });
    }

    private static void pause(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}

package autoaccept.flow;

import autoaccept.model.FlowStep;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The one mutable session record of a running service.
 *
 * <p>Created by {@link #start(Instant)} when the service connects and reset by
 * {@link #teardown(Instant)} when it is interrupted, unbound or destroyed. It
 * is only mutated from inside the single active processing cycle (guarded by
 * {@link #tryBeginProcessing()}); counters are atomics and the step is
 * volatile so status readers on other threads see recent values without
 * locking.
 *
 * <p>A torn-down record stays at {@code IDLE}: a cycle that was already running
 * when the service went away can no longer move the step, and the runner
 * starts no new cycle for it.
 */
public final class FlowState {

    private volatile FlowStep step = FlowStep.IDLE;
    private volatile Instant lastActivityTime;
    private volatile boolean active = true;

    private final AtomicInteger dialogsDetected = new AtomicInteger();
    private final AtomicInteger autoAcceptCount = new AtomicInteger();
    private final AtomicInteger sharesCompleted = new AtomicInteger();
    private final AtomicBoolean processing      = new AtomicBoolean(false);

    private FlowState(Instant now) {
        this.lastActivityTime = now;
    }

    public static FlowState start(Instant now) {
        return new FlowState(now);
    }

    // ── Step ──────────────────────────────────────────────────────────────

    public FlowStep step() {
        return step;
    }

    public Instant lastActivityTime() {
        return lastActivityTime;
    }

    /**
     * Moves to {@code next} and records forward progress.
     *
     * @return false if the session was torn down and the step left at idle
     */
    synchronized boolean advanceTo(FlowStep next, Instant now) {
        if (!active) {
            return false;
        }
        this.step = next;
        this.lastActivityTime = now;
        return true;
    }

    void resetToIdle(Instant now) {
        advanceTo(FlowStep.IDLE, now);
    }

    /**
     * Service is going away: drop progress and end the session. The processing
     * flag is left to the running cycle, which clears it when it finishes.
     */
    public synchronized void teardown(Instant now) {
        this.active = false;
        this.step = FlowStep.IDLE;
        this.lastActivityTime = now;
    }

    /** False once {@link #teardown(Instant)} has run. */
    public boolean isActive() {
        return active;
    }

    // ── Single-flight guard ──────────────────────────────────────────────

    /** Non-blocking try-lock; false means a cycle is already running. */
    public boolean tryBeginProcessing() {
        return processing.compareAndSet(false, true);
    }

    public void endProcessing() {
        processing.set(false);
    }

    public boolean isProcessing() {
        return processing.get();
    }

    // ── Counters ──────────────────────────────────────────────────────────

    void recordDialogDetected() { dialogsDetected.incrementAndGet(); }
    void recordAutoAccept()     { autoAcceptCount.incrementAndGet(); }
    void recordShareCompleted() { sharesCompleted.incrementAndGet(); }

    public int dialogsDetected() { return dialogsDetected.get(); }
    public int autoAcceptCount() { return autoAcceptCount.get(); }
    public int sharesCompleted() { return sharesCompleted.get(); }

    public FlowStats stats(boolean enabled) {
        return new FlowStats(step, dialogsDetected.get(), autoAcceptCount.get(),
                sharesCompleted.get(), processing.get(), enabled);
    }
}

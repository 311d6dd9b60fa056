package autoaccept.flow;

import autoaccept.model.FlowStep;

/**
 * What one processing cycle did, and whether it wants a follow-up check.
 *
 * @param result         what happened
 * @param step           flow step after the cycle
 * @param recovered      whether the cycle began with a stuck-state reset; set for
 *                       every {@link Result#RESET} and for a reset followed by progress
 * @param recheckAfterMs delay of the requested follow-up cycle, or 0 for none
 * @param recheckOnlyAt  the follow-up only runs if the flow is still at this step
 */
public record CycleOutcome(Result result,
                           FlowStep step,
                           boolean recovered,
                           long recheckAfterMs,
                           FlowStep recheckOnlyAt) {

    public enum Result {
        /** Window not relevant at the current step. */
        IGNORED,
        /** Expected dialog or target not present. */
        NO_MATCH,
        /** Moved one step forward. */
        ADVANCED,
        /** Finished the last step and returned to idle. */
        COMPLETED,
        /** Target found but every click strategy failed. */
        ACTION_FAILED,
        /** A stuck flow fell back to idle and the window offered nothing further. */
        RESET
    }

    static CycleOutcome of(Result result, FlowStep step) {
        return new CycleOutcome(result, step, false, 0L, null);
    }

    /** Same outcome, asking for a follow-up cycle while the flow stays at {@code step}. */
    CycleOutcome recheck(long delayMs) {
        return new CycleOutcome(result, step, recovered, delayMs, step);
    }

    /** Marks a stuck-state reset; a cycle that did nothing else reports {@code RESET}. */
    CycleOutcome markRecovered() {
        Result reported = result == Result.IGNORED || result == Result.NO_MATCH ? Result.RESET : result;
        return new CycleOutcome(reported, step, true, recheckAfterMs, recheckOnlyAt);
    }

    public boolean wantsRecheck() {
        return recheckAfterMs > 0;
    }
}

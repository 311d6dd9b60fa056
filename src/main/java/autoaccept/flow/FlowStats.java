package autoaccept.flow;

import autoaccept.model.FlowStep;

/**
 * Read-only diagnostics view of a {@link FlowState}. Values are read one by one
 * and may straddle an in-flight cycle.
 */
public record FlowStats(FlowStep step,
                        int dialogsDetected,
                        int autoAcceptCount,
                        int sharesCompleted,
                        boolean processing,
                        boolean enabled) {

    @Override
    public String toString() {
        return String.format("dialogs=%d, accepted=%d, shares=%d, step=%s(%d), processing=%s, enabled=%s",
                dialogsDetected, autoAcceptCount, sharesCompleted, step, step.code(), processing, enabled);
    }
}

package autoaccept.flow;

import java.time.Duration;

/**
 * Timing and matching knobs of the state machine.
 *
 * @param stuckTimeout      no-progress window after which the flow falls back to idle
 * @param recheckDelayMs    delay before re-checking after a transition detected by fallback
 * @param chooserRecheckMs  delay before re-checking after the chooser option was clicked
 * @param confirmRetryMs    delay before retrying a failed confirm step
 * @param selectionPhrase   text the share-mode selector must show before confirming
 */
public record FlowSettings(Duration stuckTimeout,
                           long recheckDelayMs,
                           long chooserRecheckMs,
                           long confirmRetryMs,
                           String selectionPhrase) {

    public static FlowSettings defaults() {
        return new FlowSettings(Duration.ofSeconds(30), 500L, 800L, 1000L, "entire screen");
    }
}

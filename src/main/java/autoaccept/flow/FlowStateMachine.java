package autoaccept.flow;

import autoaccept.action.ClickExecutor;
import autoaccept.detect.DialogDetector;
import autoaccept.flow.CycleOutcome.Result;
import autoaccept.locator.NodeLocator;
import autoaccept.model.AppRole;
import autoaccept.model.EvidenceReport;
import autoaccept.model.FlowStep;
import autoaccept.model.TargetSpec;
import autoaccept.platform.NotificationSink;
import autoaccept.platform.Snapshot;
import autoaccept.platform.UiNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Drives the accept-and-share flow one snapshot at a time.
 *
 * <pre>
 *   IDLE ──accept clicked──▶ AWAITING_SHARE_DIALOG ──selector clicked──▶ AWAITING_CHOOSER
 *     ▲                                                                      │
 *     └──────── confirm clicked ◀── AWAITING_SHARE_CONFIRM ◀──option clicked─┘
 * </pre>
 *
 * <p>A step only advances when the dialog it depends on is confirmed in the
 * snapshot of the current cycle. The source application is only looked at
 * while idle; the companion application only while a flow is in progress, so
 * an incidental share dialog never starts anything on its own. Each cycle
 * first checks for a stuck flow and falls back to idle when nothing has moved
 * for {@link FlowSettings#stuckTimeout()}.
 */
public class FlowStateMachine {

    private static final Logger log = LoggerFactory.getLogger(FlowStateMachine.class);

    static final String ACCEPT_BUTTON        = "accept-button";
    static final String MODE_SPINNER         = "mode-spinner";
    static final String ENTIRE_SCREEN_OPTION = "entire-screen-option";
    static final String CONFIRM_BUTTON       = "confirm-button";

    static final String MSG_ACCEPTED      = "Connection accepted";
    static final String MSG_SHARE_STARTED = "Screen sharing started";

    private enum Selection { ABSENT, TARGET_MODE, OTHER_MODE }

    private final DialogDetector detector;
    private final NodeLocator locator;
    private final ClickExecutor clicker;
    private final NotificationSink sink;
    private final FlowSettings settings;
    private final Clock clock;

    public FlowStateMachine(DialogDetector detector, NodeLocator locator, ClickExecutor clicker,
                            NotificationSink sink, FlowSettings settings, Clock clock) {
        this.detector = detector;
        this.locator  = locator;
        this.clicker  = clicker;
        this.sink     = sink;
        this.settings = settings;
        this.clock    = clock;
    }

    // ── Entry point ───────────────────────────────────────────────────────

    /**
     * Runs one cycle against a freshly acquired snapshot.
     *
     * @param state    the session record; mutated only here
     * @param snapshot snapshot of the window that triggered the cycle
     * @param app      which application the window belongs to
     */
    public CycleOutcome process(FlowState state, Snapshot snapshot, AppRole app) {
        if (!state.isActive()) {
            log.debug("Session ended; ignoring {} window", app);
            return CycleOutcome.of(Result.IGNORED, state.step());
        }
        boolean recovered = recoverIfStuck(state);
        FlowStep step = state.step();
        log.debug("Processing {} window at step {}({})", app, step, step.code());

        CycleOutcome outcome;
        if (app == AppRole.SOURCE) {
            outcome = step == FlowStep.IDLE
                    ? handleIncoming(state, snapshot)
                    : CycleOutcome.of(Result.IGNORED, step);
        } else {
            outcome = switch (step) {
                case IDLE                   -> CycleOutcome.of(Result.IGNORED, step);
                case AWAITING_SHARE_DIALOG  -> handleShareDialog(state, snapshot);
                case AWAITING_CHOOSER       -> handleChooser(state, snapshot);
                case AWAITING_SHARE_CONFIRM -> handleConfirm(state, snapshot);
            };
        }
        return recovered ? outcome.markRecovered() : outcome;
    }

    // ── Stuck-state recovery ─────────────────────────────────────────────

    /**
     * Falls back to idle when the flow has not moved for longer than the stuck
     * timeout, e.g. because the user dismissed a dialog by hand.
     */
    boolean recoverIfStuck(FlowState state) {
        Instant now = clock.instant();
        Duration idleFor = Duration.between(state.lastActivityTime(), now);
        if (idleFor.compareTo(settings.stuckTimeout()) <= 0) {
            return false;
        }
        FlowStep was = state.step();
        state.resetToIdle(now);
        if (was != FlowStep.IDLE) {
            log.info("No progress for {} s at step {}; flow reset to IDLE", idleFor.toSeconds(), was);
            return true;
        }
        return false;
    }

    // ── Step 0: incoming connection (source application) ─────────────────

    private CycleOutcome handleIncoming(FlowState state, Snapshot snapshot) {
        EvidenceReport evidence = detector.classify(snapshot, FlowStep.IDLE);
        if (!evidence.isConfirmed()) {
            return CycleOutcome.of(Result.NO_MATCH, state.step());
        }
        state.recordDialogDetected();
        log.info("Incoming connection dialog detected (total {})", state.dialogsDetected());

        Result clicked = clickRole(snapshot, ACCEPT_BUTTON);
        if (clicked != Result.ADVANCED) {
            return CycleOutcome.of(clicked, state.step());
        }
        state.recordAutoAccept();
        if (!advance(state, FlowStep.AWAITING_SHARE_DIALOG)) {
            return CycleOutcome.of(Result.IGNORED, state.step());
        }
        log.info("Connection accepted (total {})", state.autoAcceptCount());
        sink.notify(MSG_ACCEPTED);
        return CycleOutcome.of(Result.ADVANCED, state.step());
    }

    // ── Step 1: share permission dialog, open the mode selector ──────────

    private CycleOutcome handleShareDialog(FlowState state, Snapshot snapshot) {
        Result spinner = Result.NO_MATCH;
        if (detector.classify(snapshot, FlowStep.AWAITING_SHARE_DIALOG).isConfirmed()) {
            spinner = clickRole(snapshot, MODE_SPINNER);
            if (spinner == Result.ADVANCED) {
                return advance(state, FlowStep.AWAITING_CHOOSER)
                        ? CycleOutcome.of(Result.ADVANCED, state.step())
                        : CycleOutcome.of(Result.IGNORED, state.step());
            }
        }

        // the chooser may already be open, e.g. the selector was tapped by hand
        if (detector.classify(snapshot, FlowStep.AWAITING_CHOOSER).isConfirmed()) {
            log.info("Mode chooser already showing; skipping selector click");
            return advancedWithRecheck(state, FlowStep.AWAITING_CHOOSER, settings.recheckDelayMs());
        }
        return CycleOutcome.of(spinner, state.step());
    }

    // ── Step 2: mode chooser, pick "entire screen" ───────────────────────

    private CycleOutcome handleChooser(FlowState state, Snapshot snapshot) {
        if (detector.classify(snapshot, FlowStep.AWAITING_CHOOSER).isConfirmed()) {
            Result option = clickRole(snapshot, ENTIRE_SCREEN_OPTION);
            if (option != Result.ADVANCED) {
                return CycleOutcome.of(option, state.step());
            }
            return advancedWithRecheck(state, FlowStep.AWAITING_SHARE_CONFIRM, settings.chooserRecheckMs());
        }

        // chooser gone; if the dialog already shows the wanted mode, go straight to confirm
        if (detector.classify(snapshot, FlowStep.AWAITING_SHARE_CONFIRM).isConfirmed()
                && readSelection(snapshot) == Selection.TARGET_MODE) {
            log.info("Share dialog already set to '{}'", settings.selectionPhrase());
            return advancedWithRecheck(state, FlowStep.AWAITING_SHARE_CONFIRM, settings.recheckDelayMs());
        }
        return CycleOutcome.of(Result.NO_MATCH, state.step());
    }

    // ── Step 3: confirm the share ────────────────────────────────────────

    private CycleOutcome handleConfirm(FlowState state, Snapshot snapshot) {
        if (!detector.classify(snapshot, FlowStep.AWAITING_SHARE_CONFIRM).isConfirmed()) {
            return CycleOutcome.of(Result.NO_MATCH, state.step()).recheck(settings.confirmRetryMs());
        }
        if (readSelection(snapshot) == Selection.OTHER_MODE) {
            log.warn("Share-mode selector does not show '{}'; not confirming", settings.selectionPhrase());
            return CycleOutcome.of(Result.NO_MATCH, state.step()).recheck(settings.confirmRetryMs());
        }

        Result clicked = clickRole(snapshot, CONFIRM_BUTTON);
        if (clicked != Result.ADVANCED) {
            log.warn("Confirm step not completed ({}); retrying in {} ms", clicked, settings.confirmRetryMs());
            return CycleOutcome.of(clicked, state.step()).recheck(settings.confirmRetryMs());
        }
        state.recordShareCompleted();
        state.resetToIdle(clock.instant());
        log.info("Screen sharing started (total {})", state.sharesCompleted());
        sink.notify(MSG_SHARE_STARTED);
        return CycleOutcome.of(Result.COMPLETED, state.step());
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /**
     * Locates and clicks a role.
     *
     * @return {@code ADVANCED} on a successful click, {@code NO_MATCH} when the
     *         target is absent, {@code ACTION_FAILED} when every click failed
     */
    private Result clickRole(Snapshot snapshot, String role) {
        TargetSpec target = locator.catalog().target(role);
        Optional<UiNode> node = locator.locate(snapshot, target);
        if (node.isEmpty()) {
            log.info("Target '{}' not found", role);
            return Result.NO_MATCH;
        }
        try {
            return clicker.click(snapshot, node.get(), target.isEscalate())
                    ? Result.ADVANCED
                    : Result.ACTION_FAILED;
        } finally {
            snapshot.release(node.get());
        }
    }

    private Selection readSelection(Snapshot snapshot) {
        Optional<UiNode> selector = locator.locate(snapshot, MODE_SPINNER);
        if (selector.isEmpty()) {
            return Selection.ABSENT;
        }
        String shown = snapshot.displayText(selector.get());
        snapshot.release(selector.get());
        log.debug("Share-mode selector shows '{}'", shown);
        return shown.toLowerCase(Locale.ROOT).contains(settings.selectionPhrase().toLowerCase(Locale.ROOT))
                ? Selection.TARGET_MODE
                : Selection.OTHER_MODE;
    }

    /** @return false if the session ended while this cycle was running */
    private boolean advance(FlowState state, FlowStep next) {
        FlowStep was = state.step();
        if (!state.advanceTo(next, clock.instant())) {
            log.info("Session ended during the cycle; staying at IDLE instead of {}", next);
            return false;
        }
        log.info("Flow step {}({}) -> {}({})", was, was.code(), next, next.code());
        return true;
    }

    private CycleOutcome advancedWithRecheck(FlowState state, FlowStep next, long recheckMs) {
        return advance(state, next)
                ? CycleOutcome.of(Result.ADVANCED, state.step()).recheck(recheckMs)
                : CycleOutcome.of(Result.IGNORED, state.step());
    }
}

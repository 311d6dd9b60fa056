package autoaccept.action;

import autoaccept.platform.NodeAction;
import autoaccept.platform.Snapshot;
import autoaccept.platform.UiNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Clicks a located node, escalating through fallbacks when the platform
 * refuses the plain click.
 *
 * <ol>
 *   <li>{@code CLICK}.</li>
 *   <li>{@code ACCESSIBILITY_FOCUS}, settle, {@code CLICK}.</li>
 *   <li>Only when escalation is allowed for the role:
 *     <ol type="a">
 *       <li>{@code LONG_CLICK};</li>
 *       <li>{@code FOCUS}, settle, {@code CLICK};</li>
 *       <li>steps 1-2 on the clickable parent (one hop, no further escalation).</li>
 *     </ol>
 *   </li>
 * </ol>
 *
 * <p>Platform refusals and faults are expected here and never propagate; the
 * result is simply {@code false}.
 */
public class ClickExecutor {

    private static final Logger log = LoggerFactory.getLogger(ClickExecutor.class);

    private final long focusSettleMs;
    private final long altFocusSettleMs;

    /**
     * @param focusSettleMs    pause after accessibility focus before re-clicking
     * @param altFocusSettleMs pause after input focus in the escalated path
     */
    public ClickExecutor(long focusSettleMs, long altFocusSettleMs) {
        this.focusSettleMs    = focusSettleMs;
        this.altFocusSettleMs = altFocusSettleMs;
    }

    /**
     * Clicks {@code node}.
     *
     * @param snapshot the snapshot that owns {@code node}; parent handles opened
     *                 for delegation are released through it
     * @param escalate whether long-press, input focus and parent delegation may be tried
     * @return true as soon as one strategy is accepted by the platform
     */
    public boolean click(Snapshot snapshot, UiNode node, boolean escalate) {
        if (node == null) {
            return false;
        }
        log.debug("Clicking {} text='{}'", node.className(), node.text());
        try {
            if (basicClick(node)) {
                return true;
            }
            if (escalate && escalatedClick(snapshot, node)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Click on {} interrupted", node.className());
            return false;
        } catch (RuntimeException e) {
            log.warn("Click on {} failed with platform fault ({}): {}",
                    node.className(), e.getClass().getSimpleName(), e.getMessage());
            return false;
        }
        log.warn("All click strategies failed for {} text='{}'", node.className(), node.text());
        return false;
    }

    // ── Strategies ────────────────────────────────────────────────────────

    private boolean basicClick(UiNode node) throws InterruptedException {
        if (node.performAction(NodeAction.CLICK)) {
            log.debug("Click accepted");
            return true;
        }
        if (node.performAction(NodeAction.ACCESSIBILITY_FOCUS)) {
            pause(focusSettleMs);
            if (node.performAction(NodeAction.CLICK)) {
                log.debug("Click accepted after accessibility focus");
                return true;
            }
        }
        return false;
    }

    private boolean escalatedClick(Snapshot snapshot, UiNode node) throws InterruptedException {
        log.debug("Escalating click on {}", node.className());

        if (node.performAction(NodeAction.LONG_CLICK)) {
            log.debug("Long click accepted");
            return true;
        }

        if (node.performAction(NodeAction.FOCUS)) {
            pause(altFocusSettleMs);
            if (node.performAction(NodeAction.CLICK)) {
                log.debug("Click accepted after input focus");
                return true;
            }
        }

        UiNode parent = snapshot.parent(node).orElse(null);
        if (parent == null) {
            return false;
        }
        try {
            if (parent.isClickable()) {
                log.debug("Delegating click to clickable parent {}", parent.className());
                return basicClick(parent);
            }
            return false;
        } finally {
            snapshot.release(parent);
        }
    }

    private static void pause(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}

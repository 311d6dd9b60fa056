package autoaccept.detect;

import autoaccept.locator.NodeLocator;
import autoaccept.model.DialogShape;
import autoaccept.model.EvidenceReport;
import autoaccept.model.FlowStep;
import autoaccept.model.MatcherSpec;
import autoaccept.model.SignalSpec;
import autoaccept.model.TargetCatalog;
import autoaccept.platform.MatchCriteria;
import autoaccept.platform.Snapshot;
import autoaccept.platform.UiNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a snapshot shows a known dialog by adding up weak,
 * independent signals.
 *
 * <p>No single id or caption is trusted: each {@link SignalSpec} of the shape
 * is checked on its own and contributes its weight once. The shape counts as
 * present when the total reaches its threshold, and catalogs are validated so
 * that no one signal can reach it alone.
 */
public class DialogDetector {

    private static final Logger log = LoggerFactory.getLogger(DialogDetector.class);

    private final TargetCatalog catalog;
    private final NodeLocator locator;

    public DialogDetector(TargetCatalog catalog, NodeLocator locator) {
        this.catalog = catalog;
        this.locator = locator;
    }

    /** Scores the snapshot against the dialog expected at {@code candidateStep}. */
    public EvidenceReport classify(Snapshot snapshot, FlowStep candidateStep) {
        return classify(snapshot, candidateStep.shapeName());
    }

    /** Scores the snapshot against a named catalog shape. */
    public EvidenceReport classify(Snapshot snapshot, String shapeName) {
        return classify(snapshot, catalog.shape(shapeName));
    }

    public EvidenceReport classify(Snapshot snapshot, DialogShape shape) {
        int score = 0;
        List<String> held = new ArrayList<>();
        for (SignalSpec signal : shape.getSignals()) {
            if (holds(snapshot, signal)) {
                score += signal.getWeight();
                held.add(signal.getName());
                log.debug("[{}] signal '{}' +{}", shape.getName(), signal.getName(), signal.getWeight());
            }
        }
        EvidenceReport report = new EvidenceReport(shape.getName(), score, shape.getThreshold(), held);
        if (report.isConfirmed()) {
            log.info("Dialog '{}' confirmed with {} evidence point(s): {}", shape.getName(), score, held);
        } else if (score > 0) {
            log.debug("Dialog '{}' not confirmed: {}", shape.getName(), report);
        }
        return report;
    }

    // ── Internal helpers ─────────────────────────────────────────────────

    private boolean holds(Snapshot snapshot, SignalSpec signal) {
        if (!signal.getTargets().isEmpty()) {
            return allTargetsPresent(snapshot, signal.getTargets());
        }
        for (MatcherSpec matcher : signal.getMatchers()) {
            if (snapshot.exists(MatchCriteria.from(matcher))) {
                return true;
            }
        }
        return false;
    }

    private boolean allTargetsPresent(Snapshot snapshot, List<String> roles) {
        List<UiNode> found = new ArrayList<>();
        try {
            for (String role : roles) {
                Optional<UiNode> node = locator.locate(snapshot, role);
                if (node.isEmpty()) {
                    return false;
                }
                found.add(node.get());
            }
            return true;
        } finally {
            snapshot.releaseAll(found);
        }
    }
}

package autoaccept.locator;

import autoaccept.model.MatcherSpec;
import autoaccept.model.MatcherSpec.Kind;
import autoaccept.model.TargetCatalog;
import autoaccept.model.TargetSpec;
import autoaccept.platform.MatchCriteria;
import autoaccept.platform.Snapshot;
import autoaccept.platform.UiNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds the node that plays a semantic role (for example
 * {@code "accept-button"}) in the current snapshot by trying the role's
 * matchers in catalog order: view id, then literal text, then a structural
 * tree walk, then the last-known screen rectangle.
 *
 * <p>Text hits that are not clickable themselves (a label inside a clickable
 * row) are promoted to their nearest clickable ancestor when the matcher asks
 * for it. Handles opened along the way are released through the snapshot;
 * only the returned node stays live.
 */
public class NodeLocator {

    private static final Logger log = LoggerFactory.getLogger(NodeLocator.class);

    private final TargetCatalog catalog;

    public NodeLocator(TargetCatalog catalog) {
        this.catalog = catalog;
    }

    /** Winning matcher plus the node it produced. */
    private record LocateMatch(MatcherSpec matcher, UiNode node) {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Locates the node for a catalog role.
     *
     * @throws autoaccept.model.AutoAcceptException if the role is unknown
     */
    public Optional<UiNode> locate(Snapshot snapshot, String role) {
        return locate(snapshot, catalog.target(role));
    }

    public Optional<UiNode> locate(Snapshot snapshot, TargetSpec target) {
        for (MatcherSpec matcher : target.getMatchers()) {
            log.debug("[{}] trying {}", target.getName(), matcher);
            LocateMatch m = tryMatcher(snapshot, matcher);
            if (m != null) {
                if (m.matcher().getKind() == Kind.BOUNDS) {
                    log.warn("[{}] located only by absolute bounds {}; UI ids and text did not match",
                            target.getName(), m.matcher().getBounds());
                } else {
                    log.debug("[{}] located with {}", target.getName(), m.matcher());
                }
                return Optional.of(m.node());
            }
        }
        log.debug("[{}] not found after {} matcher(s)", target.getName(), target.getMatchers().size());
        return Optional.empty();
    }

    public TargetCatalog catalog() {
        return catalog;
    }

    // ── Internal helpers ─────────────────────────────────────────────────

    private LocateMatch tryMatcher(Snapshot snapshot, MatcherSpec matcher) {
        MatchCriteria criteria = MatchCriteria.from(matcher);
        if (matcher.getKind() == Kind.TEXT && matcher.isWalkUp()) {
            UiNode node = firstInteractiveForText(snapshot, criteria);
            return node != null ? new LocateMatch(matcher, node) : null;
        }
        return snapshot.first(criteria)
                .map(node -> new LocateMatch(matcher, node))
                .orElse(null);
    }

    /**
     * Walks every text hit in order; the first one that is clickable, or has a
     * clickable ancestor, wins. Hits without one are dropped.
     */
    private UiNode firstInteractiveForText(Snapshot snapshot, MatchCriteria criteria) {
        List<UiNode> hits = snapshot.query(criteria);
        UiNode winner = null;
        for (UiNode hit : hits) {
            if (winner == null) {
                winner = nearestClickable(snapshot, hit);
            }
            if (hit != winner) {
                snapshot.release(hit);
            }
        }
        return winner;
    }

    /**
     * Returns {@code node} when clickable, otherwise the nearest clickable
     * ancestor, or null when the root is reached without one. Ancestors that
     * are passed over are released immediately.
     */
    static UiNode nearestClickable(Snapshot snapshot, UiNode node) {
        if (node.isClickable()) {
            return node;
        }
        UiNode current = snapshot.parent(node).orElse(null);
        int depth = 1;
        while (current != null) {
            if (current.isClickable()) {
                log.debug("Promoted non-clickable '{}' to clickable ancestor {} level(s) up",
                        node.text(), depth);
                return current;
            }
            UiNode next = snapshot.parent(current).orElse(null);
            snapshot.release(current);
            current = next;
            depth++;
        }
        return null;
    }
}

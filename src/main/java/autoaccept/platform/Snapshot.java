package autoaccept.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Point-in-time view of the active window, owned by exactly one processing
 * cycle.
 *
 * <p>Every handle the snapshot hands out (root, query results, parents,
 * children) is tracked. {@link #release(UiNode)} frees a handle early;
 * {@link #close()} frees whatever is left, so callers can return, bail out
 * or throw at any point without leaking platform handles:
 *
 * <pre>{@code
 * try (Snapshot snapshot = access.acquireSnapshot().orElseThrow()) {
 *     snapshot.first(MatchCriteria.viewId("android:id/button1")).ifPresent(...);
 * }
 * }</pre>
 *
 * <p>Not thread-safe: a snapshot never leaves the cycle that acquired it.
 */
public final class Snapshot implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Snapshot.class);

    private final UiNode root;
    private final Runnable onClose;
    private final Set<UiNode> live = Collections.newSetFromMap(new IdentityHashMap<>());

    private int issued;
    private int released;
    private boolean closed;

    Snapshot(UiNode root, Runnable onClose) {
        this.root    = root;
        this.onClose = onClose;
        track(root);
    }

    // ── Queries ───────────────────────────────────────────────────────────

    public UiNode root() {
        ensureOpen();
        return root;
    }

    /**
     * All nodes matching {@code criteria}, in platform order for indexed kinds
     * and breadth-first order for traversal kinds. Rejected candidates are
     * released before returning.
     */
    public List<UiNode> query(MatchCriteria criteria) {
        ensureOpen();
        return criteria.needsTraversal()
                ? traverse(criteria, false)
                : filter(indexedLookup(criteria), criteria, false);
    }

    /** First node matching {@code criteria}; every other candidate is released. */
    public Optional<UiNode> first(MatchCriteria criteria) {
        ensureOpen();
        List<UiNode> hits = criteria.needsTraversal()
                ? traverse(criteria, true)
                : filter(indexedLookup(criteria), criteria, true);
        return hits.isEmpty() ? Optional.empty() : Optional.of(hits.get(0));
    }

    public boolean exists(MatchCriteria criteria) {
        Optional<UiNode> hit = first(criteria);
        hit.ifPresent(this::release);
        return hit.isPresent();
    }

    /** Tracked handle to the parent of {@code node}, empty at the root. */
    public Optional<UiNode> parent(UiNode node) {
        ensureOpen();
        return Optional.ofNullable(track(node.parent()));
    }

    /** Tracked handle to a child of {@code node}. */
    public Optional<UiNode> child(UiNode node, int index) {
        ensureOpen();
        return Optional.ofNullable(track(node.child(index)));
    }

    /**
     * Text a user would read on the node: its own text, or the first non-empty
     * child text (selectors render their value in a child view).
     */
    public String displayText(UiNode node) {
        String own = node.text();
        if (own != null && !own.isBlank()) {
            return own.trim();
        }
        for (int i = 0; i < node.childCount(); i++) {
            UiNode child = track(node.child(i));
            if (child == null) continue;
            String text = child.text();
            release(child);
            if (text != null && !text.isBlank()) {
                return text.trim();
            }
        }
        return "";
    }

    // ── Release ───────────────────────────────────────────────────────────

    /**
     * Releases one handle. Safe to call twice and safe on handles the platform
     * has already invalidated. The root stays valid until {@link #close()}.
     */
    public void release(UiNode node) {
        if (node == null || (node == root && !closed)) {
            return;
        }
        if (!live.remove(node)) {
            return;
        }
        released++;
        try {
            node.release();
        } catch (RuntimeException e) {
            log.debug("Ignoring release fault on stale handle ({}): {}",
                    e.getClass().getSimpleName(), e.getMessage());
        }
    }

    public void releaseAll(Iterable<UiNode> nodes) {
        for (UiNode node : nodes) {
            release(node);
        }
    }

    /** Releases every handle still held, the root last. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (UiNode node : new ArrayList<>(live)) {
            if (node != root) {
                release(node);
            }
        }
        release(root);
        onClose.run();
        log.trace("Snapshot closed: {} handle(s) issued, {} released", issued, released);
    }

    // ── Accounting ────────────────────────────────────────────────────────

    public int issuedCount()   { return issued; }
    public int releasedCount() { return released; }
    public int liveCount()     { return live.size(); }
    public boolean isClosed()  { return closed; }

    // ── Internal helpers ─────────────────────────────────────────────────

    private UiNode track(UiNode node) {
        if (node != null && live.add(node)) {
            issued++;
        }
        return node;
    }

    private List<UiNode> indexedLookup(MatchCriteria criteria) {
        List<UiNode> raw = switch (criteria.kind()) {
            case ID   -> root.findByViewId(criteria.key());
            case TEXT -> root.findByText(criteria.key());
            default   -> List.of();
        };
        List<UiNode> tracked = new ArrayList<>(raw == null ? 0 : raw.size());
        if (raw != null) {
            for (UiNode node : raw) {
                if (track(node) != null) {
                    tracked.add(node);
                }
            }
        }
        return tracked;
    }

    private List<UiNode> filter(List<UiNode> candidates, MatchCriteria criteria, boolean firstOnly) {
        // a throwing predicate leaves the unvisited tail tracked; close() frees it
        List<UiNode> hits = new ArrayList<>();
        for (UiNode node : candidates) {
            if ((!firstOnly || hits.isEmpty()) && criteria.matches(this, node)) {
                hits.add(node);
            } else {
                release(node);
            }
        }
        return hits;
    }

    private List<UiNode> traverse(MatchCriteria criteria, boolean firstOnly) {
        List<UiNode> hits = new ArrayList<>();
        Deque<UiNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            UiNode current = queue.poll();
            boolean hit = criteria.matches(this, current);
            if (hit) {
                hits.add(current);
                if (firstOnly) {
                    releaseAll(queue);
                    return hits;
                }
            }
            for (int c = 0; c < current.childCount(); c++) {
                UiNode child = track(current.child(c));
                if (child != null) {
                    queue.add(child);
                }
            }
            if (!hit) {
                release(current);
            }
        }
        return hits;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Snapshot already closed");
        }
    }
}

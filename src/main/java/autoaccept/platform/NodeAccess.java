package autoaccept.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hands out {@link Snapshot}s of the active window, at most one at a time.
 */
public class NodeAccess {

    private static final Logger log = LoggerFactory.getLogger(NodeAccess.class);

    private final UiPlatform platform;
    private final AtomicBoolean snapshotLive = new AtomicBoolean(false);

    public NodeAccess(UiPlatform platform) {
        this.platform = platform;
    }

    /**
     * Acquires a snapshot of the active window.
     *
     * @return the snapshot, or empty when the platform has no active window
     * @throws IllegalStateException if the previous snapshot was never closed
     */
    public Optional<Snapshot> acquireSnapshot() {
        if (!snapshotLive.compareAndSet(false, true)) {
            throw new IllegalStateException("A snapshot is already live; close it before acquiring another");
        }
        UiNode root;
        try {
            root = platform.rootInActiveWindow();
        } catch (RuntimeException e) {
            snapshotLive.set(false);
            throw e;
        }
        if (root == null) {
            snapshotLive.set(false);
            log.debug("No active window root available");
            return Optional.empty();
        }
        return Optional.of(new Snapshot(root, () -> snapshotLive.set(false)));
    }

    public boolean isSnapshotLive() {
        return snapshotLive.get();
    }

    public UiPlatform platform() {
        return platform;
    }
}

package autoaccept.gate;

import java.util.EnumMap;
import java.util.Map;

/**
 * {@link TaskScheduler} that never runs anything by itself: tests inspect the
 * pending tasks and fire them with {@link #runPending(TaskPurpose)}.
 */
public final class ManualTaskScheduler implements TaskScheduler {

    private record Pending(long delayMs, Runnable task) {}

    private final Map<TaskPurpose, Pending> pending = new EnumMap<>(TaskPurpose.class);
    private final Map<TaskPurpose, Integer> scheduled = new EnumMap<>(TaskPurpose.class);
    private final Map<TaskPurpose, Integer> replaced  = new EnumMap<>(TaskPurpose.class);
    private boolean shutdown;

    @Override
    public synchronized void schedule(TaskPurpose purpose, long delayMs, Runnable task) {
        if (shutdown) return;
        if (pending.put(purpose, new Pending(delayMs, task)) != null) {
            replaced.merge(purpose, 1, Integer::sum);
        }
        scheduled.merge(purpose, 1, Integer::sum);
    }

    @Override
    public synchronized void cancel(TaskPurpose purpose) {
        pending.remove(purpose);
    }

    @Override
    public synchronized void cancelAll() {
        pending.clear();
    }

    @Override
    public synchronized boolean isPending(TaskPurpose purpose) {
        return pending.containsKey(purpose);
    }

    @Override
    public synchronized void shutdown() {
        pending.clear();
        shutdown = true;
    }

    /**
     * Runs and removes the pending task of {@code purpose}.
     *
     * @return false if nothing was pending
     */
    public boolean runPending(TaskPurpose purpose) {
        Pending p;
        synchronized (this) {
            p = pending.remove(purpose);
        }
        if (p == null) return false;
        p.task().run();
        return true;
    }

    public synchronized long delayOf(TaskPurpose purpose) {
        Pending p = pending.get(purpose);
        if (p == null) throw new IllegalStateException("Nothing pending for " + purpose);
        return p.delayMs();
    }

    public synchronized int scheduledCount(TaskPurpose purpose) {
        return scheduled.getOrDefault(purpose, 0);
    }

    public synchronized int replacedCount(TaskPurpose purpose) {
        return replaced.getOrDefault(purpose, 0);
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }
}

package autoaccept.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} backed by a single daemon scheduler thread, so
 * deferred tasks never overlap one another.
 *
 * <pre>{@code
 * TaskScheduler tasks = new DeferredTaskScheduler("autoaccept-scheduler");
 * tasks.schedule(TaskPurpose.SETTLE, 400, () -> runner.trigger(state, app));
 * tasks.schedule(TaskPurpose.SETTLE, 400, ...);   // first one is cancelled
 * }</pre>
 */
public class DeferredTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(DeferredTaskScheduler.class);

    private final ScheduledExecutorService executor;
    private final Map<TaskPurpose, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public DeferredTaskScheduler(String threadName) {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        }));
    }

    /** Package-private constructor for tests that supply their own executor. */
    DeferredTaskScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public void schedule(TaskPurpose purpose, long delayMs, Runnable task) {
        if (executor.isShutdown()) {
            log.debug("Scheduler shut down; dropping {} task", purpose);
            return;
        }
        pending.compute(purpose, (p, previous) -> {
            if (previous != null && previous.cancel(false)) {
                log.debug("Replaced pending {} task", p);
            }
            return executor.schedule(guarded(p, task), Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        });
    }

    @Override
    public void cancel(TaskPurpose purpose) {
        ScheduledFuture<?> future = pending.remove(purpose);
        if (future != null && future.cancel(false)) {
            log.debug("Cancelled pending {} task", purpose);
        }
    }

    @Override
    public void cancelAll() {
        for (TaskPurpose purpose : TaskPurpose.values()) {
            cancel(purpose);
        }
    }

    @Override
    public boolean isPending(TaskPurpose purpose) {
        ScheduledFuture<?> future = pending.get(purpose);
        return future != null && !future.isDone();
    }

    @Override
    public void shutdown() {
        cancelAll();
        executor.shutdownNow();
        log.debug("Deferred task scheduler stopped");
    }

    /** Scheduled executors drop exceptions silently; log them instead. */
    private static Runnable guarded(TaskPurpose purpose, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Deferred {} task failed", purpose, e);
            }
        };
    }
}

package autoaccept.gate;

/**
 * Cancellable deferred tasks keyed by {@link TaskPurpose}. Scheduling a task
 * replaces (cancels) the pending task of the same purpose.
 */
public interface TaskScheduler {

    void schedule(TaskPurpose purpose, long delayMs, Runnable task);

    /** Cancels the pending task of {@code purpose}, if any. */
    void cancel(TaskPurpose purpose);

    void cancelAll();

    boolean isPending(TaskPurpose purpose);

    /** Cancels everything and stops accepting tasks. */
    void shutdown();
}

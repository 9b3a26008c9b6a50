package io.marketstream.gateway.core;

/**
 * Serial executor with delayed tasks and a clock. All tasks of one scheduler run
 * one at a time, in submission order for tasks due at the same time.
 */
public interface TaskScheduler extends AutoCloseable {

    /**
     * Current time in milliseconds since epoch.
     */
    long now();

    /**
     * Runs {@code task} as soon as possible.
     */
    void execute(Runnable task);

    /**
     * Runs {@code task} after {@code delayMs}.
     */
    Cancellable schedule(Runnable task, long delayMs);

    /**
     * Stops the scheduler. Pending delayed tasks are dropped.
     */
    @Override
    void close();

    /**
     * Handle of a delayed task.
     */
    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}

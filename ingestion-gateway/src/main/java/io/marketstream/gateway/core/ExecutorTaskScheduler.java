package io.marketstream.gateway.core;

import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} on a single daemon thread.
 */
public class ExecutorTaskScheduler implements TaskScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private static final long SHUTDOWN_GRACE_MS = 2000;

    private final String name;
    private final EpochClock clock;
    private final ScheduledThreadPoolExecutor executor;

    public ExecutorTaskScheduler(String name, EpochClock clock) {
        this.name = name;
        this.clock = clock;
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, "conn-" + name.toLowerCase());
            thread.setDaemon(true);
            return thread;
        });
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public long now() {
        return clock.time();
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guard(task));
        } catch (RejectedExecutionException e) {
            LOGGER.debug("[{}] Task rejected, scheduler stopped", name);
        }
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMs) {
        try {
            ScheduledFuture<?> future = executor.schedule(guard(task), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("[{}] Delayed task rejected, scheduler stopped", name);
            return () -> { };
        }
    }

    /**
     * Lets queued tasks finish for a short grace period, then interrupts the thread.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                if (!executor.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                    LOGGER.warn("[{}] Connection thread did not terminate", name);
                }
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOGGER.error("[{}] Unhandled error in connection task", name, e);
            }
        };
    }
}

package io.marketstream.gateway.core;

/**
 * Retry bookkeeping of one connection. Confined to the connection's scheduler thread.
 */
public class BackoffState {

    private int attempts;
    private long nextRetryAt;

    /**
     * Counts a failure and returns the number of the retry it calls for.
     */
    public int recordFailure() {
        return ++attempts;
    }

    public void scheduleRetry(long retryAt) {
        this.nextRetryAt = retryAt;
    }

    public void reset() {
        attempts = 0;
        nextRetryAt = 0;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * Earliest time of the next retry, 0 when none is pending.
     */
    public long nextRetryAt() {
        return nextRetryAt;
    }
}

package io.marketstream.gateway.core;

/**
 * Bounded exponential backoff.
 *
 * <p>delay(attempt) = min(baseDelayMs * multiplier^(attempt - 1), maxDelayMs).
 * Attempt {@code maxRetries + 1} is not made; the connection fails instead.
 *
 * @param baseDelayMs Delay before the first retry
 * @param multiplier  Growth factor per attempt, at least 1
 * @param maxDelayMs  Delay ceiling
 * @param maxRetries  Retries allowed before giving up
 */
public record BackoffPolicy(
    long baseDelayMs,
    double multiplier,
    long maxDelayMs,
    int maxRetries
) {
    public static final long DEFAULT_BASE_DELAY_MS = 1000;
    public static final double DEFAULT_MULTIPLIER = 1.5;
    public static final long DEFAULT_MAX_DELAY_MS = 60000;
    public static final int DEFAULT_MAX_RETRIES = 10;

    public BackoffPolicy {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive");
        }
        if (multiplier < 1.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a finite value >= 1");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs cannot be less than baseDelayMs");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE_DELAY_MS, DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY_MS, DEFAULT_MAX_RETRIES);
    }

    /**
     * Delay before retry number {@code attempt} (1-based).
     */
    public long delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double delay = baseDelayMs * Math.pow(multiplier, attempt - 1);
        return delay >= maxDelayMs ? maxDelayMs : (long) delay;
    }

    /**
     * Whether retry number {@code attempt} exceeds the budget.
     */
    public boolean isExhausted(int attempt) {
        return attempt > maxRetries;
    }
}

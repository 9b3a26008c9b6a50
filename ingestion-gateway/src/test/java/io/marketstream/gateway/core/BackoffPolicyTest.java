package io.marketstream.gateway.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BackoffPolicy.
 */
class BackoffPolicyTest {

    @Test
    void testDefaults() {
        BackoffPolicy policy = BackoffPolicy.defaults();

        assertEquals(1000, policy.delayFor(1));
        assertEquals(1500, policy.delayFor(2));
        assertEquals(2250, policy.delayFor(3));
    }

    @Test
    void testDelaysNonDecreasingAndCapped() {
        BackoffPolicy policy = new BackoffPolicy(1000, 1.5, 60_000, 50);

        long previous = 0;
        for (int attempt = 1; attempt <= 50; attempt++) {
            long delay = policy.delayFor(attempt);
            assertTrue(delay >= previous, "delay decreased at attempt " + attempt);
            assertTrue(delay <= 60_000, "delay above ceiling at attempt " + attempt);
            previous = delay;
        }
        assertEquals(60_000, policy.delayFor(50));
    }

    @Test
    void testExhaustedAfterMaxRetries() {
        BackoffPolicy policy = new BackoffPolicy(100, 2.0, 1000, 3);

        assertFalse(policy.isExhausted(1));
        assertFalse(policy.isExhausted(3));
        assertTrue(policy.isExhausted(4));
    }

    @Test
    void testInvalidPolicyRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(0, 1.5, 1000, 3));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(100, 0.5, 1000, 3));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(100, 1.5, 50, 3));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(100, 1.5, 1000, -1));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.defaults().delayFor(0));
    }

    @Test
    void testBackoffStateCounts() {
        BackoffState state = new BackoffState();

        assertEquals(1, state.recordFailure());
        assertEquals(2, state.recordFailure());
        state.scheduleRetry(5000);
        assertEquals(5000, state.nextRetryAt());

        state.reset();
        assertEquals(0, state.attempts());
        assertEquals(0, state.nextRetryAt());
    }
}

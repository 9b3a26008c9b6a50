package io.marketstream.gateway.core;

import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;
import org.agrona.concurrent.CachedEpochClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HealthMonitor.
 */
class HealthMonitorTest {

    private static final ConnectionId BITGET = new ConnectionId(Exchange.BITGET, MarketType.FUTURES);
    private static final ConnectionId KUCOIN = new ConnectionId(Exchange.KUCOIN, MarketType.SPOT);

    @Test
    void testUnhealthyChecksCounted() {
        CachedEpochClock clock = new CachedEpochClock();
        clock.update(1000);
        StubChecker bitget = new StubChecker(ConnectionState.STREAMING);
        StubChecker kucoin = new StubChecker(ConnectionState.CONNECTING);

        try (HealthMonitor monitor = new HealthMonitor(5000, clock)) {
            monitor.registerConnection(BITGET, bitget);
            monitor.registerConnection(KUCOIN, kucoin);

            monitor.performHealthCheck();
            clock.update(6000);
            monitor.performHealthCheck();

            assertEquals(0, monitor.getStats(BITGET).getUnhealthyChecks());
            assertEquals(2, monitor.getStats(KUCOIN).getUnhealthyChecks());
            assertEquals(6000, monitor.getStats(KUCOIN).getLastUnhealthyTime());
            assertFalse(monitor.isHealthy());

            kucoin.state = ConnectionState.STREAMING;
            assertTrue(monitor.isHealthy());
        }
    }

    @Test
    void testUnregister() {
        try (HealthMonitor monitor = new HealthMonitor(5000, new CachedEpochClock())) {
            monitor.registerConnection(BITGET, new StubChecker(ConnectionState.DISCONNECTED));
            monitor.unregisterConnection(BITGET);

            assertNull(monitor.getStats(BITGET));
            assertTrue(monitor.isHealthy());
        }
    }

    private static final class StubChecker implements HealthMonitor.ConnectionChecker {
        private ConnectionState state;

        private StubChecker(ConnectionState state) {
            this.state = state;
        }

        @Override
        public ConnectionState state() {
            return state;
        }

        @Override
        public boolean isFatal() {
            return false;
        }

        @Override
        public int retryAttempts() {
            return 0;
        }

        @Override
        public long getMessageCount() {
            return 0;
        }

        @Override
        public long getErrorCount() {
            return 0;
        }
    }
}

package io.marketstream.gateway.core;

import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Monitors the health of streaming connections and reports statistics.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    private final long checkIntervalMs;
    private final EpochClock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<ConnectionId, ConnectionStats> statsMap = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    public HealthMonitor(long checkIntervalMs, EpochClock clock) {
        this.checkIntervalMs = checkIntervalMs;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Registers a connection for monitoring, replacing any earlier registration.
     */
    public void registerConnection(ConnectionId id, ConnectionChecker checker) {
        statsMap.put(id, new ConnectionStats(id, checker));
    }

    public void unregisterConnection(ConnectionId id) {
        statsMap.remove(id);
    }

    /**
     * Starts the health monitor.
     */
    public void start() {
        if (running) {
            return;
        }

        running = true;
        scheduler.scheduleAtFixedRate(
            this::performHealthCheck,
            checkIntervalMs,
            checkIntervalMs,
            TimeUnit.MILLISECONDS
        );

        LOGGER.info("Health monitor started (interval: {} ms)", checkIntervalMs);
    }

    /**
     * Stops the health monitor.
     */
    public void stop() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Health monitor stopped");
    }

    /**
     * Performs a health check on all registered connections.
     */
    void performHealthCheck() {
        long now = clock.time();
        for (ConnectionStats stats : statsMap.values()) {
            ConnectionState state = stats.checker.state();
            stats.update(state, now);

            if (state != ConnectionState.STREAMING) {
                if (stats.checker.isFatal()) {
                    LOGGER.error("[HealthMonitor] {} has failed permanently", stats.id.name());
                } else {
                    LOGGER.warn("[HealthMonitor] {} is {} (retry attempt {})",
                        stats.id.name(), state, stats.checker.retryAttempts());
                }
            }
        }
    }

    /**
     * Logs a summary of connection statistics.
     */
    public void logSummary() {
        LOGGER.info("=== Health Monitor Summary ===");
        for (ConnectionStats stats : statsMap.values()) {
            LOGGER.info("{}: state={}, messages={}, errors={}, unhealthyChecks={}, lastUnhealthy={}",
                stats.id.name(),
                stats.checker.state(),
                stats.getMessageCount(),
                stats.getErrorCount(),
                stats.unhealthyChecks,
                stats.lastUnhealthyTime
            );
        }
        LOGGER.info("=============================");
    }

    /**
     * Gets connection statistics for a connection.
     */
    public ConnectionStats getStats(ConnectionId id) {
        return statsMap.get(id);
    }

    public Collection<ConnectionStats> getAllStats() {
        return statsMap.values();
    }

    /**
     * True when every registered connection is streaming.
     */
    public boolean isHealthy() {
        return statsMap.values().stream().allMatch(stats -> stats.checker.state() == ConnectionState.STREAMING);
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Interface for checking connection status.
     */
    public interface ConnectionChecker {
        ConnectionState state();
        boolean isFatal();
        int retryAttempts();
        long getMessageCount();
        long getErrorCount();

        static ConnectionChecker of(ReconnectSupervisor supervisor) {
            return new ConnectionChecker() {
                @Override
                public ConnectionState state() {
                    return supervisor.state();
                }

                @Override
                public boolean isFatal() {
                    return supervisor.isFatal();
                }

                @Override
                public int retryAttempts() {
                    return supervisor.retryAttempts();
                }

                @Override
                public long getMessageCount() {
                    return supervisor.messageCount();
                }

                @Override
                public long getErrorCount() {
                    return supervisor.errorCount();
                }
            };
        }
    }

    /**
     * Statistics for a connection.
     */
    public static class ConnectionStats {
        private final ConnectionId id;
        private final ConnectionChecker checker;
        private volatile long unhealthyChecks = 0;
        private volatile long lastUnhealthyTime = 0;

        public ConnectionStats(ConnectionId id, ConnectionChecker checker) {
            this.id = id;
            this.checker = checker;
        }

        private void update(ConnectionState state, long now) {
            if (state != ConnectionState.STREAMING) {
                unhealthyChecks++;
                lastUnhealthyTime = now;
            }
        }

        public ConnectionId getId() {
            return id;
        }

        public ConnectionState getState() {
            return checker.state();
        }

        public boolean isFatal() {
            return checker.isFatal();
        }

        public int getRetryAttempts() {
            return checker.retryAttempts();
        }

        public long getUnhealthyChecks() {
            return unhealthyChecks;
        }

        public long getLastUnhealthyTime() {
            return lastUnhealthyTime;
        }

        public long getMessageCount() {
            return checker.getMessageCount();
        }

        public long getErrorCount() {
            return checker.getErrorCount();
        }
    }
}

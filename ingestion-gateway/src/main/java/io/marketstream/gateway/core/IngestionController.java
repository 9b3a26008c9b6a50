package io.marketstream.gateway.core;

import io.marketstream.gateway.auth.Credentials;
import io.marketstream.gateway.auth.CredentialsProvider;
import io.marketstream.gateway.auth.EnvCredentialsProvider;
import io.marketstream.gateway.config.ConnectionConfig;
import io.marketstream.gateway.config.GatewayConfig;
import io.marketstream.gateway.dispatch.ConsumerHandle;
import io.marketstream.gateway.dispatch.EventConsumer;
import io.marketstream.gateway.dispatch.EventDispatcher;
import io.marketstream.gateway.example.LoggingEventConsumer;
import io.marketstream.gateway.metrics.GatewayMetrics;
import io.marketstream.gateway.metrics.MetricsServer;
import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;
import org.agrona.CloseHelper;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.agrona.concurrent.SystemEpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Control surface of the ingestion core.
 * Owns the connections, the event dispatcher, health monitoring and the metrics server.
 */
public class IngestionController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionController.class);

    private final GatewayConfig config;
    private final GatewayMetrics metrics;
    private final CredentialsProvider credentialsProvider;
    private final ConnectionFactory connectionFactory;
    private final EventDispatcher dispatcher;
    private final HealthMonitor healthMonitor;
    private final MetricsServer metricsServer;
    private final Map<ConnectionId, ReconnectSupervisor> supervisors = new ConcurrentHashMap<>();

    private ShutdownSignalBarrier shutdownBarrier;
    private volatile boolean closed;

    public IngestionController(GatewayConfig config) {
        this(config, new GatewayMetrics(), new EnvCredentialsProvider(), SystemEpochClock.INSTANCE,
            new DefaultConnectionFactory(SystemEpochClock.INSTANCE, false));
    }

    public IngestionController(
        GatewayConfig config,
        GatewayMetrics metrics,
        CredentialsProvider credentialsProvider,
        EpochClock clock,
        ConnectionFactory connectionFactory
    ) {
        this.config = config;
        this.metrics = metrics;
        this.credentialsProvider = credentialsProvider;
        this.connectionFactory = connectionFactory;
        this.dispatcher = new EventDispatcher(
            config.dispatchQueueCapacity(),
            config.dispatchOverflowPolicy(),
            config.dispatchPublishTimeoutMs(),
            metrics
        );
        this.healthMonitor = new HealthMonitor(config.healthCheckMs(), clock);
        this.metricsServer = config.metricsPort() > 0
            ? new MetricsServer(config.metricsPort(), metrics, config, this)
            : null;

        LOGGER.info("Ingestion controller initialized: {}", config.gatewayId());
    }

    /**
     * Starts health monitoring, the metrics server and every enabled configured connection.
     */
    public void start() throws IOException {
        LOGGER.info("Starting ingestion gateway...");

        healthMonitor.start();
        if (metricsServer != null) {
            metricsServer.start();
        }
        if (config.logEvents()) {
            registerConsumer("event-logger", new LoggingEventConsumer());
        }

        for (ConnectionConfig connectionConfig : config.connections()) {
            if (!connectionConfig.enabled()) {
                LOGGER.info("Skipping disabled connection: {} {}", connectionConfig.exchange(), connectionConfig.marketType());
                continue;
            }
            ConnectionId id = startConnection(connectionConfig.exchange(), connectionConfig.marketType(), null);
            for (SubscriptionKey key : connectionConfig.subscriptions()) {
                try {
                    addSubscription(id, key.symbol(), key.channel());
                } catch (IllegalArgumentException e) {
                    LOGGER.error("[{}] Skipping subscription {}: {}", id.name(), key, e.getMessage());
                }
            }
        }

        LOGGER.info("Ingestion gateway started");
        logStatus();
    }

    /**
     * Starts a connection, or restarts it when it is idle or has failed.
     * A connection that is already running is left alone.
     *
     * @param credentials API credentials, or null to consult the credentials provider
     */
    public synchronized ConnectionId startConnection(Exchange exchange, MarketType marketType, Credentials credentials) {
        if (closed) {
            throw new IllegalStateException("controller is closed");
        }
        ConnectionId id = new ConnectionId(exchange, marketType);
        ReconnectSupervisor existing = supervisors.get(id);
        if (existing != null) {
            existing.start();
            return id;
        }

        Credentials effective = credentials != null
            ? credentials
            : credentialsProvider.getCredentials(exchange).orElse(null);
        ReconnectSupervisor supervisor = connectionFactory.create(
            id, effective, dispatcher::publish, config.backoffPolicy(), metrics);
        supervisors.put(id, supervisor);
        healthMonitor.registerConnection(id, HealthMonitor.ConnectionChecker.of(supervisor));
        supervisor.start();
        LOGGER.info("[{}] Connection started ({} channels)", id.name(), effective != null ? "private" : "public");
        return id;
    }

    /**
     * Stops a connection and releases its resources. Its subscriptions are forgotten.
     *
     * @return false if the connection was not running
     */
    public synchronized boolean stopConnection(ConnectionId id) {
        ReconnectSupervisor supervisor = supervisors.remove(id);
        if (supervisor == null) {
            return false;
        }
        healthMonitor.unregisterConnection(id);
        supervisor.close();
        return true;
    }

    /**
     * Adds a pair to a connection's desired set.
     *
     * @return false if the pair was already desired
     * @throws IllegalArgumentException for an unknown connection or a pair the exchange cannot encode
     */
    public boolean addSubscription(ConnectionId id, String symbol, String channel) {
        return supervisor(id).subscriptions().add(symbol, channel);
    }

    /**
     * Removes a pair from a connection's desired set.
     *
     * @return false if the pair was not desired
     */
    public boolean removeSubscription(ConnectionId id, String symbol, String channel) {
        return supervisor(id).subscriptions().remove(symbol, channel);
    }

    public ConsumerHandle registerConsumer(EventConsumer consumer) {
        return dispatcher.subscribe(consumer);
    }

    public ConsumerHandle registerConsumer(String name, EventConsumer consumer) {
        return dispatcher.subscribe(name, consumer);
    }

    public boolean unregisterConsumer(ConsumerHandle handle) {
        return dispatcher.unsubscribe(handle);
    }

    public ConnectionState connectionState(ConnectionId id) {
        return supervisor(id).state();
    }

    public Set<SubscriptionKey> desiredSubscriptions(ConnectionId id) {
        return supervisor(id).subscriptions().desiredSet();
    }

    public Set<SubscriptionKey> confirmedSubscriptions(ConnectionId id) {
        return supervisor(id).subscriptions().confirmedSet();
    }

    public Set<ConnectionId> connections() {
        return Set.copyOf(supervisors.keySet());
    }

    /**
     * Live supervisors, for status reporting.
     */
    public Collection<ReconnectSupervisor> supervisors() {
        return List.copyOf(supervisors.values());
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    private ReconnectSupervisor supervisor(ConnectionId id) {
        ReconnectSupervisor supervisor = supervisors.get(id);
        if (supervisor == null) {
            throw new IllegalArgumentException("Unknown connection: " + id);
        }
        return supervisor;
    }

    /**
     * Waits for shutdown signal.
     */
    public void waitForShutdown() {
        LOGGER.info("Gateway running. Press Ctrl+C to shutdown.");
        getShutdownBarrier().await();

        LOGGER.info("Shutdown signal received");
    }

    /**
     * Gets the shutdown barrier for external signal handling.
     */
    public synchronized ShutdownSignalBarrier getShutdownBarrier() {
        if (shutdownBarrier == null) {
            shutdownBarrier = new ShutdownSignalBarrier();
        }
        return shutdownBarrier;
    }

    /**
     * Stops every connection and consumer.
     */
    public void shutdown() {
        List<ReconnectSupervisor> toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(supervisors.values());
            supervisors.clear();
        }
        LOGGER.info("Shutting down ingestion gateway...");

        for (ReconnectSupervisor supervisor : toClose) {
            try {
                supervisor.close();
            } catch (Exception e) {
                LOGGER.error("[{}] Error closing connection", supervisor.id().name(), e);
            }
        }
        CloseHelper.closeAll(healthMonitor, metricsServer, dispatcher);

        LOGGER.info("Ingestion gateway shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Logs current gateway status.
     */
    public void logStatus() {
        LOGGER.info("=== Gateway Status ===");
        LOGGER.info("Gateway ID: {}", config.gatewayId());
        LOGGER.info("Consumers: {} (overflow policy {})", dispatcher.consumerCount(), dispatcher.overflowPolicy());
        for (ReconnectSupervisor supervisor : supervisors.values()) {
            LOGGER.info("{}: state={}, desired={}, confirmed={}, messages={}, errors={}",
                supervisor.id().name(),
                supervisor.state(),
                supervisor.subscriptions().desiredSet().size(),
                supervisor.subscriptions().confirmedSet().size(),
                supervisor.messageCount(),
                supervisor.errorCount()
            );
        }
        healthMonitor.logSummary();
        LOGGER.info("=====================");
    }
}

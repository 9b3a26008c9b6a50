package io.marketstream.gateway.config;

import io.marketstream.gateway.core.BackoffPolicy;
import io.marketstream.gateway.dispatch.OverflowPolicy;
import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for the ingestion gateway.
 *
 * @param gatewayId                Unique gateway instance identifier
 * @param connections              Connections started at boot
 * @param reconnectBaseDelayMs     Delay before the first reconnect
 * @param reconnectMaxDelayMs      Reconnect delay ceiling
 * @param reconnectMultiplier      Reconnect delay growth factor
 * @param reconnectMaxRetries      Reconnects allowed before a connection fails
 * @param dispatchQueueCapacity    Per-consumer queue capacity
 * @param dispatchOverflowPolicy   Behaviour when a consumer queue is full
 * @param dispatchPublishTimeoutMs Longest a publish may wait for queue space
 * @param healthCheckMs            Health check interval in milliseconds
 * @param metricsPort              Port for the metrics and status HTTP server
 * @param logEvents                Whether to register the logging consumer
 */
public record GatewayConfig(
    String gatewayId,
    List<ConnectionConfig> connections,
    long reconnectBaseDelayMs,
    long reconnectMaxDelayMs,
    double reconnectMultiplier,
    int reconnectMaxRetries,
    int dispatchQueueCapacity,
    OverflowPolicy dispatchOverflowPolicy,
    long dispatchPublishTimeoutMs,
    int healthCheckMs,
    int metricsPort,
    boolean logEvents
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayConfig.class);

    private static final String DEFAULT_GATEWAY_ID = "gateway-0";
    private static final String DEFAULT_CONNECTIONS =
        "bitget:futures:true:BTCUSDT/ticker,BTCUSDT/trade;kucoin:futures:true:XBTUSDTM/ticker";
    private static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    private static final long DEFAULT_PUBLISH_TIMEOUT_MS = 100;
    private static final int DEFAULT_HEALTH_CHECK_MS = 5000;
    private static final int DEFAULT_METRICS_PORT = 9090;

    public GatewayConfig {
        if (gatewayId == null || gatewayId.isEmpty()) {
            throw new IllegalArgumentException("gatewayId cannot be null or empty");
        }
        connections = connections == null ? List.of() : List.copyOf(connections);
        if (dispatchQueueCapacity <= 0) {
            throw new IllegalArgumentException("dispatchQueueCapacity must be positive");
        }
        if (dispatchOverflowPolicy == null) {
            throw new IllegalArgumentException("dispatchOverflowPolicy cannot be null");
        }
        if (dispatchPublishTimeoutMs < 0) {
            throw new IllegalArgumentException("dispatchPublishTimeoutMs cannot be negative");
        }
        if (healthCheckMs <= 0) {
            throw new IllegalArgumentException("healthCheckMs must be positive");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 0 and 65535");
        }
        // validates the reconnect settings
        new BackoffPolicy(reconnectBaseDelayMs, reconnectMultiplier, reconnectMaxDelayMs, reconnectMaxRetries);
    }

    /**
     * Backoff policy built from the reconnect settings.
     */
    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(reconnectBaseDelayMs, reconnectMultiplier, reconnectMaxDelayMs, reconnectMaxRetries);
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - GATEWAY_ID: Gateway instance ID (default: "gateway-0")
     * - CONNECTIONS: Connection configs (e.g., "bitget:futures:true:BTCUSDT/ticker,BTCUSDT/trade;kucoin:spot:true:BTC-USDT/ticker")
     * - RECONNECT_BASE_DELAY_MS / RECONNECT_MAX_DELAY_MS / RECONNECT_MULTIPLIER / RECONNECT_MAX_RETRIES (defaults: 1000 / 60000 / 1.5 / 10)
     * - DISPATCH_QUEUE_CAPACITY: Per-consumer queue capacity (default: 10000)
     * - DISPATCH_OVERFLOW_POLICY: drop_oldest or backpressure (default: drop_oldest)
     * - DISPATCH_PUBLISH_TIMEOUT_MS: Backpressure wait (default: 100)
     * - HEALTH_CHECK_MS: Health check interval (default: 5000)
     * - METRICS_PORT: HTTP port, 0 disables the server (default: 9090)
     * - LOG_EVENTS: Log every event (default: false)
     */
    public static GatewayConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Loads configuration from the given variable lookup.
     */
    public static GatewayConfig fromEnv(Function<String, String> env) {
        String gatewayId = stringEnv(env, "GATEWAY_ID", DEFAULT_GATEWAY_ID);
        String connectionsStr = stringEnv(env, "CONNECTIONS", DEFAULT_CONNECTIONS);

        List<ConnectionConfig> connections = Arrays.stream(connectionsStr.split(";"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(ConnectionConfig::fromString)
            .collect(Collectors.toList());

        OverflowPolicy overflowPolicy;
        try {
            overflowPolicy = OverflowPolicy.fromString(stringEnv(env, "DISPATCH_OVERFLOW_POLICY", "drop_oldest"));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("{}, using default: DROP_OLDEST", e.getMessage());
            overflowPolicy = OverflowPolicy.DROP_OLDEST;
        }

        return new GatewayConfig(
            gatewayId,
            connections,
            parseLongEnv(env, "RECONNECT_BASE_DELAY_MS", BackoffPolicy.DEFAULT_BASE_DELAY_MS),
            parseLongEnv(env, "RECONNECT_MAX_DELAY_MS", BackoffPolicy.DEFAULT_MAX_DELAY_MS),
            parseDoubleEnv(env, "RECONNECT_MULTIPLIER", BackoffPolicy.DEFAULT_MULTIPLIER),
            (int) parseLongEnv(env, "RECONNECT_MAX_RETRIES", BackoffPolicy.DEFAULT_MAX_RETRIES),
            (int) parseLongEnv(env, "DISPATCH_QUEUE_CAPACITY", DEFAULT_QUEUE_CAPACITY),
            overflowPolicy,
            parseLongEnv(env, "DISPATCH_PUBLISH_TIMEOUT_MS", DEFAULT_PUBLISH_TIMEOUT_MS),
            (int) parseLongEnv(env, "HEALTH_CHECK_MS", DEFAULT_HEALTH_CHECK_MS),
            (int) parseLongEnv(env, "METRICS_PORT", DEFAULT_METRICS_PORT),
            Boolean.parseBoolean(stringEnv(env, "LOG_EVENTS", "false"))
        );
    }

    private static String stringEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private static long parseLongEnv(Function<String, String> env, String key, long defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static double parseDoubleEnv(Function<String, String> env, String key, double defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Creates a new builder for GatewayConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for GatewayConfig.
     */
    public static class Builder {
        private String gatewayId = DEFAULT_GATEWAY_ID;
        private final List<ConnectionConfig> connections = new ArrayList<>();
        private long reconnectBaseDelayMs = BackoffPolicy.DEFAULT_BASE_DELAY_MS;
        private long reconnectMaxDelayMs = BackoffPolicy.DEFAULT_MAX_DELAY_MS;
        private double reconnectMultiplier = BackoffPolicy.DEFAULT_MULTIPLIER;
        private int reconnectMaxRetries = BackoffPolicy.DEFAULT_MAX_RETRIES;
        private int dispatchQueueCapacity = DEFAULT_QUEUE_CAPACITY;
        private OverflowPolicy dispatchOverflowPolicy = OverflowPolicy.DROP_OLDEST;
        private long dispatchPublishTimeoutMs = DEFAULT_PUBLISH_TIMEOUT_MS;
        private int healthCheckMs = DEFAULT_HEALTH_CHECK_MS;
        private int metricsPort = DEFAULT_METRICS_PORT;
        private boolean logEvents;

        public Builder gatewayId(String gatewayId) {
            this.gatewayId = gatewayId;
            return this;
        }

        public Builder addConnection(Exchange exchange, MarketType marketType, SubscriptionKey... subscriptions) {
            this.connections.add(new ConnectionConfig(exchange, marketType, true, List.of(subscriptions)));
            return this;
        }

        public Builder reconnect(long baseDelayMs, double multiplier, long maxDelayMs, int maxRetries) {
            this.reconnectBaseDelayMs = baseDelayMs;
            this.reconnectMultiplier = multiplier;
            this.reconnectMaxDelayMs = maxDelayMs;
            this.reconnectMaxRetries = maxRetries;
            return this;
        }

        public Builder dispatch(int queueCapacity, OverflowPolicy overflowPolicy, long publishTimeoutMs) {
            this.dispatchQueueCapacity = queueCapacity;
            this.dispatchOverflowPolicy = overflowPolicy;
            this.dispatchPublishTimeoutMs = publishTimeoutMs;
            return this;
        }

        public Builder healthCheckMs(int healthCheckMs) {
            this.healthCheckMs = healthCheckMs;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder logEvents(boolean logEvents) {
            this.logEvents = logEvents;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(
                gatewayId,
                connections,
                reconnectBaseDelayMs,
                reconnectMaxDelayMs,
                reconnectMultiplier,
                reconnectMaxRetries,
                dispatchQueueCapacity,
                dispatchOverflowPolicy,
                dispatchPublishTimeoutMs,
                healthCheckMs,
                metricsPort,
                logEvents
            );
        }
    }
}

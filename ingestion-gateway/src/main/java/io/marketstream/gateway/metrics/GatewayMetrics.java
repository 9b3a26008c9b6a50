package io.marketstream.gateway.metrics;

import io.marketstream.gateway.core.ConnectionId;
import io.marketstream.gateway.core.ConnectionState;
import io.marketstream.gateway.event.ErrorKind;
import io.marketstream.normalizer.model.EventType;
import io.marketstream.normalizer.model.Exchange;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.Summary;
import io.prometheus.client.hotspot.DefaultExports;

/**
 * Prometheus metrics for the ingestion gateway.
 *
 * Tracks:
 * - Events received per exchange and event type, and events handed to the dispatcher
 * - Protocol errors, connection errors, reconnect attempts and fatal errors
 * - Connection state and confirmed subscriptions per connection
 * - Events dropped and consumer failures per consumer
 * - Normalization latency and raw message size
 */
public class GatewayMetrics {

    private final CollectorRegistry registry;

    // Counters
    private final Counter eventsReceived;
    private final Counter eventsDispatched;
    private final Counter protocolErrors;
    private final Counter connectionErrors;
    private final Counter reconnectAttempts;
    private final Counter fatalErrors;
    private final Counter eventsDropped;
    private final Counter consumerFailures;

    // Gauges
    private final Gauge connectionState;
    private final Gauge activeSubscriptions;

    private final Summary normalizeLatency;
    private final Histogram messageSize;

    /**
     * Registers gateway and JVM metrics with the default registry.
     */
    public GatewayMetrics() {
        this(CollectorRegistry.defaultRegistry, true);
    }

    /**
     * @param registry   Registry to register with; tests pass a fresh one
     * @param jvmMetrics Whether to also register the hotspot collectors (GC, memory, threads)
     */
    public GatewayMetrics(CollectorRegistry registry, boolean jvmMetrics) {
        this.registry = registry;
        if (jvmMetrics) {
            DefaultExports.register(registry);
        }

        this.eventsReceived = Counter.build()
            .name("gateway_events_received_total")
            .help("Total number of normalized events received from exchanges")
            .labelNames("exchange", "event_type")
            .register(registry);

        this.eventsDispatched = Counter.build()
            .name("gateway_events_dispatched_total")
            .help("Total number of events handed to the dispatcher")
            .labelNames("exchange")
            .register(registry);

        this.protocolErrors = Counter.build()
            .name("gateway_protocol_errors_total")
            .help("Total number of messages that could not be normalized")
            .labelNames("exchange")
            .register(registry);

        this.connectionErrors = Counter.build()
            .name("gateway_connection_errors_total")
            .help("Total number of connection failures")
            .labelNames("connection", "kind")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("gateway_reconnect_attempts_total")
            .help("Total number of reconnection attempts")
            .labelNames("connection")
            .register(registry);

        this.fatalErrors = Counter.build()
            .name("gateway_fatal_errors_total")
            .help("Total number of connections that exhausted their retry budget")
            .labelNames("connection")
            .register(registry);

        this.eventsDropped = Counter.build()
            .name("gateway_events_dropped_total")
            .help("Total number of events dropped because a consumer queue was full")
            .labelNames("consumer")
            .register(registry);

        this.consumerFailures = Counter.build()
            .name("gateway_consumer_failures_total")
            .help("Total number of exceptions thrown by consumers")
            .labelNames("consumer")
            .register(registry);

        this.connectionState = Gauge.build()
            .name("gateway_connection_state")
            .help("Connection state (0=DISCONNECTED, 1=CONNECTING, 2=AUTHENTICATING, 3=SUBSCRIBING, 4=STREAMING, 5=CLOSING)")
            .labelNames("connection")
            .register(registry);

        this.activeSubscriptions = Gauge.build()
            .name("gateway_active_subscriptions")
            .help("Number of confirmed subscriptions")
            .labelNames("connection")
            .register(registry);

        this.normalizeLatency = Summary.build()
            .name("gateway_normalize_latency_microseconds")
            .help("Time to normalize one raw message in microseconds")
            .labelNames("exchange")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register(registry);

        this.messageSize = Histogram.build()
            .name("gateway_message_size_bytes")
            .help("Raw message size distribution in bytes")
            .labelNames("exchange")
            .buckets(100, 500, 1000, 5000, 10000, 100000)
            .register(registry);
    }

    public void recordEventReceived(Exchange exchange, EventType eventType) {
        eventsReceived.labels(exchange.name(), eventType.name()).inc();
    }

    public void recordEventDispatched(Exchange exchange) {
        eventsDispatched.labels(exchange.name()).inc();
    }

    public void recordProtocolError(Exchange exchange) {
        protocolErrors.labels(exchange.name()).inc();
    }

    public void recordConnectionError(ConnectionId id, ErrorKind kind) {
        connectionErrors.labels(id.name(), kind.name()).inc();
    }

    public void recordReconnectAttempt(ConnectionId id) {
        reconnectAttempts.labels(id.name()).inc();
    }

    public void recordFatalError(ConnectionId id) {
        fatalErrors.labels(id.name()).inc();
    }

    public void recordEventDropped(String consumer) {
        eventsDropped.labels(consumer).inc();
    }

    public void recordConsumerFailure(String consumer) {
        consumerFailures.labels(consumer).inc();
    }

    public void setConnectionState(ConnectionId id, ConnectionState state) {
        connectionState.labels(id.name()).set(state.code());
    }

    public void setActiveSubscriptions(ConnectionId id, int count) {
        activeSubscriptions.labels(id.name()).set(count);
    }

    /**
     * Records normalization latency.
     *
     * @param exchange      The exchange
     * @param latencyMicros Latency in microseconds
     */
    public void recordNormalizeLatency(Exchange exchange, double latencyMicros) {
        normalizeLatency.labels(exchange.name()).observe(latencyMicros);
    }

    public void recordMessageSize(Exchange exchange, int sizeBytes) {
        messageSize.labels(exchange.name()).observe(sizeBytes);
    }

    public double getEventsReceived(Exchange exchange, EventType eventType) {
        return eventsReceived.labels(exchange.name(), eventType.name()).get();
    }

    public double getProtocolErrors(Exchange exchange) {
        return protocolErrors.labels(exchange.name()).get();
    }

    public double getReconnectAttempts(ConnectionId id) {
        return reconnectAttempts.labels(id.name()).get();
    }

    public double getEventsDropped(String consumer) {
        return eventsDropped.labels(consumer).get();
    }

    /**
     * Returns the CollectorRegistry for the HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}

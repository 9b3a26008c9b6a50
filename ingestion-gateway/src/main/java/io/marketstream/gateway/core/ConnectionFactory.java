package io.marketstream.gateway.core;

import io.marketstream.gateway.auth.Credentials;
import io.marketstream.gateway.metrics.GatewayMetrics;
import io.marketstream.normalizer.model.StreamEvent;

import java.util.function.Consumer;

/**
 * Builds the supervisor and its collaborators for one connection.
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * @param id          The connection to build
     * @param credentials API credentials, or null for public channels
     * @param publisher   Sink for every event the connection emits
     * @param policy      Reconnect policy
     * @param metrics     Metrics registry
     */
    ReconnectSupervisor create(
        ConnectionId id,
        Credentials credentials,
        Consumer<StreamEvent> publisher,
        BackoffPolicy policy,
        GatewayMetrics metrics
    );
}

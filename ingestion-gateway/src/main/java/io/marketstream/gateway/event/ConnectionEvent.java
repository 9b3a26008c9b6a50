package io.marketstream.gateway.event;

import io.marketstream.gateway.core.ConnectionId;
import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.StreamEvent;

/**
 * Connection or subscription lifecycle change.
 *
 * @param connectionId The connection concerned
 * @param type         What happened
 * @param receivedAt   Local time of the change in milliseconds
 * @param subscription The pair concerned, or null
 * @param errorKind    Failure classification, or null when nothing failed
 * @param message      Human-readable detail, or null
 */
public record ConnectionEvent(
    ConnectionId connectionId,
    ConnectionEventType type,
    long receivedAt,
    SubscriptionKey subscription,
    ErrorKind errorKind,
    String message
) implements StreamEvent {
    public ConnectionEvent {
        if (connectionId == null) {
            throw new IllegalArgumentException("connectionId cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    public static ConnectionEvent connected(ConnectionId id, long now) {
        return new ConnectionEvent(id, ConnectionEventType.CONNECTED, now, null, null, null);
    }

    public static ConnectionEvent disconnected(ConnectionId id, long now, ErrorKind kind, String reason) {
        return new ConnectionEvent(id, ConnectionEventType.DISCONNECTED, now, null, kind, reason);
    }

    public static ConnectionEvent subscriptionAcked(ConnectionId id, long now, SubscriptionKey key) {
        return new ConnectionEvent(id, ConnectionEventType.SUBSCRIPTION_ACKED, now, key, null, null);
    }

    public static ConnectionEvent subscriptionFailed(ConnectionId id, long now, SubscriptionKey key, String reason) {
        return new ConnectionEvent(id, ConnectionEventType.SUBSCRIPTION_FAILED, now, key, ErrorKind.SUBSCRIPTION, reason);
    }

    public static ConnectionEvent fatal(ConnectionId id, long now, String reason) {
        return new ConnectionEvent(id, ConnectionEventType.FATAL_ERROR, now, null, ErrorKind.FATAL, reason);
    }

    @Override
    public Exchange exchange() {
        return connectionId.exchange();
    }
}

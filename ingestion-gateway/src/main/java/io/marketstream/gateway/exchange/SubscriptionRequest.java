package io.marketstream.gateway.exchange;

import io.marketstream.gateway.subscription.SubscriptionKey;

import java.util.List;

/**
 * An encoded subscribe or unsubscribe frame.
 *
 * @param payload   Text frame to send
 * @param requestId Correlation id echoed by the exchange, or null when acks carry the pair instead
 * @param keys      Pairs covered by this frame
 */
public record SubscriptionRequest(
    String payload,
    String requestId,
    List<SubscriptionKey> keys
) {
    public SubscriptionRequest {
        if (payload == null || payload.isEmpty()) {
            throw new IllegalArgumentException("payload cannot be null or empty");
        }
        keys = List.copyOf(keys);
    }
}

package io.marketstream.gateway.exchange;

import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;

import java.util.List;

/**
 * Wire-level differences between exchanges: request encoding, keepalive payload and cadence.
 */
public interface ExchangeProtocol {

    Exchange exchange();

    MarketType marketType();

    /**
     * Default keepalive interval, used when the handshake does not advertise one.
     */
    long keepaliveIntervalMs();

    /**
     * Returns a new correlation id for a request or ping.
     */
    String nextRequestId();

    /**
     * Keepalive payload. {@code pingId} is ignored by exchanges whose pings carry no id.
     */
    String pingPayload(String pingId);

    /**
     * Whether pongs echo the ping id.
     */
    boolean correlatesPings();

    /**
     * Rejects pairs this exchange cannot encode.
     *
     * @throws IllegalArgumentException if the pair cannot be subscribed
     */
    default void validate(SubscriptionKey key) {
    }

    List<SubscriptionRequest> subscribe(List<SubscriptionKey> keys);

    List<SubscriptionRequest> unsubscribe(List<SubscriptionKey> keys);

    /**
     * The symbol as it appears on the wire for a caller-supplied symbol.
     */
    String wireSymbol(String symbol);
}

package io.marketstream.normalizer.api;

import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketEvent;

import java.util.List;

/**
 * Maps raw WebSocket messages of one exchange to canonical market events.
 *
 * <p>Implementations ignore unknown fields and never throw for bad input: a
 * payload that cannot be mapped produces exactly one
 * {@link io.marketstream.normalizer.model.ControlKind#PROTOCOL_ERROR} control
 * event carrying the raw payload.
 */
public interface MessageNormalizer {

    /**
     * Gets the exchange this normalizer understands.
     */
    Exchange exchange();

    /**
     * Normalizes a raw message.
     *
     * @param message    The raw text frame from the exchange
     * @param receivedAt Local receive time in milliseconds since epoch
     * @return canonical events, possibly several for batched payloads and empty for an empty batch
     */
    List<MarketEvent> normalize(String message, long receivedAt);

    /**
     * Returns a normalizer for the given exchange.
     */
    static MessageNormalizer forExchange(Exchange exchange) {
        return switch (exchange) {
            case BITGET -> new io.marketstream.normalizer.impl.bitget.BitgetMessageNormalizer();
            case KUCOIN -> new io.marketstream.normalizer.impl.kucoin.KucoinMessageNormalizer();
        };
    }
}

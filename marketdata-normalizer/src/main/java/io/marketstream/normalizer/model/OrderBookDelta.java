package io.marketstream.normalizer.model;

import java.util.List;

/**
 * Order book snapshot or incremental update.
 *
 * @param exchange   The exchange identifier
 * @param symbol     Exchange-native symbol
 * @param timestamp  Exchange timestamp in milliseconds
 * @param receivedAt Local receive timestamp in milliseconds
 * @param bids       Bid levels
 * @param asks       Ask levels
 * @param snapshot   True if this replaces the whole book
 * @param sequence   Exchange sequence number, 0 when not provided
 */
public record OrderBookDelta(
    Exchange exchange,
    String symbol,
    long timestamp,
    long receivedAt,
    List<OrderBookLevel> bids,
    List<OrderBookLevel> asks,
    boolean snapshot,
    long sequence
) implements MarketEvent {
    public OrderBookDelta {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (bids == null) {
            throw new IllegalArgumentException("bids cannot be null");
        }
        if (asks == null) {
            throw new IllegalArgumentException("asks cannot be null");
        }
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }

    @Override
    public EventType type() {
        return EventType.ORDER_BOOK_DELTA;
    }
}

package io.marketstream.normalizer.model;

import java.math.BigDecimal;

/**
 * Unified trade data model across all exchanges.
 *
 * @param exchange   The exchange identifier
 * @param symbol     Exchange-native symbol
 * @param timestamp  Trade timestamp in milliseconds
 * @param receivedAt Local receive timestamp in milliseconds
 * @param tradeId    Exchange trade identifier
 * @param price      Trade price
 * @param quantity   Trade quantity
 * @param side       Taker side
 */
public record Trade(
    Exchange exchange,
    String symbol,
    long timestamp,
    long receivedAt,
    String tradeId,
    BigDecimal price,
    BigDecimal quantity,
    Side side
) implements MarketEvent {
    public Trade {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (tradeId == null) {
            throw new IllegalArgumentException("tradeId cannot be null");
        }
        if (price == null || quantity == null) {
            throw new IllegalArgumentException("price and quantity cannot be null");
        }
        if (side == null) {
            throw new IllegalArgumentException("side cannot be null");
        }
    }

    @Override
    public EventType type() {
        return EventType.TRADE;
    }
}

package io.marketstream.normalizer.model;

import java.math.BigDecimal;

/**
 * Unified ticker data model across all exchanges.
 * Price and size fields are null when the venue does not report them on this channel.
 *
 * @param exchange     The exchange identifier
 * @param symbol       Exchange-native symbol (e.g., "BTCUSDT")
 * @param timestamp    Exchange timestamp in milliseconds
 * @param receivedAt   Local receive timestamp in milliseconds
 * @param lastPrice    Last traded price
 * @param bidPrice     Best bid price
 * @param askPrice     Best ask price
 * @param bidQuantity  Best bid quantity
 * @param askQuantity  Best ask quantity
 * @param high24h      24-hour high
 * @param low24h       24-hour low
 * @param volume24h    24-hour base volume
 * @param change24h    24-hour change ratio as reported by the exchange
 */
public record Ticker(
    Exchange exchange,
    String symbol,
    long timestamp,
    long receivedAt,
    BigDecimal lastPrice,
    BigDecimal bidPrice,
    BigDecimal askPrice,
    BigDecimal bidQuantity,
    BigDecimal askQuantity,
    BigDecimal high24h,
    BigDecimal low24h,
    BigDecimal volume24h,
    BigDecimal change24h
) implements MarketEvent {
    public Ticker {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
    }

    @Override
    public EventType type() {
        return EventType.TICKER;
    }
}

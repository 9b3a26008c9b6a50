package io.marketstream.normalizer.model;

import java.math.BigDecimal;

/**
 * Unified candlestick model.
 *
 * @param exchange    The exchange identifier
 * @param symbol      Exchange-native symbol
 * @param timestamp   Candle open time in milliseconds
 * @param receivedAt  Local receive timestamp in milliseconds
 * @param interval    Interval label in the subscription vocabulary (e.g. "1m", "1H")
 * @param open        Open price
 * @param high        High price
 * @param low         Low price
 * @param close       Close (latest) price
 * @param volume      Base volume
 * @param quoteVolume Quote volume, null when not reported
 */
public record Candle(
    Exchange exchange,
    String symbol,
    long timestamp,
    long receivedAt,
    String interval,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal quoteVolume
) implements MarketEvent {
    public Candle {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (open == null || high == null || low == null || close == null || volume == null) {
            throw new IllegalArgumentException("OHLCV fields cannot be null");
        }
    }

    @Override
    public EventType type() {
        return EventType.CANDLE;
    }
}

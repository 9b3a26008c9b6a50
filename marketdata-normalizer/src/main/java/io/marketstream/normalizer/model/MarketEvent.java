package io.marketstream.normalizer.model;

/**
 * Canonical, exchange-agnostic market event.
 * Implementations are immutable records; {@link #type()} tags the variant.
 */
public interface MarketEvent extends StreamEvent {

    /**
     * Variant tag.
     */
    EventType type();

    /**
     * Exchange-native symbol (e.g. "BTCUSDT", "XBTUSDTM", "BTC-USDT").
     * May be null for control events that do not refer to an instrument.
     */
    String symbol();

    /**
     * Exchange event time in milliseconds since epoch.
     */
    long timestamp();
}

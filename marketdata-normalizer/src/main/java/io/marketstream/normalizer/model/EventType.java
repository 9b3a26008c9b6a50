package io.marketstream.normalizer.model;

/**
 * Tag of a canonical market event.
 */
public enum EventType {
    TICKER,
    TRADE,
    CANDLE,
    ORDER_BOOK_DELTA,
    CONTROL
}

package io.marketstream.normalizer.model;

/**
 * Trade side (buy or sell).
 */
public enum Side {
    BUY,
    SELL,
    UNKNOWN;

    public static Side fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase()) {
            case "buy", "b", "bid" -> BUY;
            case "sell", "s", "ask" -> SELL;
            default -> UNKNOWN;
        };
    }
}

package io.marketstream.normalizer.model;

/**
 * Market segment of a streaming connection.
 */
public enum MarketType {
    SPOT("spot"),
    FUTURES("futures");

    private final String displayName;

    MarketType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static MarketType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("market type cannot be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "spot" -> SPOT;
            case "futures", "future", "usdt-futures", "swap" -> FUTURES;
            default -> throw new IllegalArgumentException("Unknown market type: " + value);
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}

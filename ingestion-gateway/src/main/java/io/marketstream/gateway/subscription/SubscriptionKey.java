package io.marketstream.gateway.subscription;

/**
 * A (symbol, channel) pair requested on one connection.
 *
 * @param symbol  Exchange-native symbol (e.g. "BTCUSDT", "XBTUSDTM", "BTC-USDT")
 * @param channel Canonical channel name (e.g. "ticker", "trade", "candle1m", "books5")
 */
public record SubscriptionKey(String symbol, String channel) {
    public SubscriptionKey {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be null or blank");
        }
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
        symbol = symbol.trim();
        channel = channel.trim();
    }

    @Override
    public String toString() {
        return symbol + "/" + channel;
    }
}

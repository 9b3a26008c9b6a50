package io.marketstream.gateway.config;

import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for a single streaming connection.
 *
 * @param exchange      The exchange identifier
 * @param marketType    Spot or futures feed
 * @param enabled       Whether this connection is started
 * @param subscriptions Pairs subscribed at startup
 */
public record ConnectionConfig(
    Exchange exchange,
    MarketType marketType,
    boolean enabled,
    List<SubscriptionKey> subscriptions
) {
    public ConnectionConfig {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (marketType == null) {
            throw new IllegalArgumentException("marketType cannot be null");
        }
        subscriptions = subscriptions == null ? List.of() : List.copyOf(subscriptions);
    }

    /**
     * Parses a connection configuration string.
     * Format: "exchange:market:enabled[:symbol/channel,symbol/channel...]"
     * Example: "bitget:futures:true:BTCUSDT/ticker,BTCUSDT/candle1m"
     */
    public static ConnectionConfig fromString(String value) {
        String[] parts = value.trim().split(":", 4);
        if (parts.length < 3) {
            throw new IllegalArgumentException("Invalid connection config format: " + value);
        }

        Exchange exchange;
        try {
            exchange = Exchange.valueOf(parts[0].trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown exchange: " + parts[0], e);
        }
        MarketType marketType = MarketType.fromString(parts[1]);
        boolean enabled = Boolean.parseBoolean(parts[2].trim());

        List<SubscriptionKey> subscriptions = new ArrayList<>();
        if (parts.length == 4 && !parts[3].isBlank()) {
            for (String entry : parts[3].split(",")) {
                String pair = entry.trim();
                if (pair.isEmpty()) {
                    continue;
                }
                int slash = pair.lastIndexOf('/');
                if (slash <= 0 || slash == pair.length() - 1) {
                    throw new IllegalArgumentException("Invalid subscription (expected symbol/channel): " + pair);
                }
                subscriptions.add(new SubscriptionKey(pair.substring(0, slash), pair.substring(slash + 1)));
            }
        }

        return new ConnectionConfig(exchange, marketType, enabled, subscriptions);
    }
}

package io.marketstream.gateway.core;

import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;

/**
 * Identifies one streaming connection.
 *
 * @param exchange   The exchange
 * @param marketType Spot or futures feed
 */
public record ConnectionId(Exchange exchange, MarketType marketType) {
    public ConnectionId {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (marketType == null) {
            throw new IllegalArgumentException("marketType cannot be null");
        }
    }

    /**
     * Name used in log lines and thread names, e.g. {@code BITGET-FUTURES}.
     */
    public String name() {
        return exchange.name() + "-" + marketType.name();
    }

    @Override
    public String toString() {
        return name();
    }
}

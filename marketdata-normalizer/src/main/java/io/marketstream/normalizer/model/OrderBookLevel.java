package io.marketstream.normalizer.model;

import java.math.BigDecimal;

/**
 * Single price level in an order book. A zero quantity in a delta removes the level.
 *
 * @param price    Price level
 * @param quantity Total quantity at this price level
 */
public record OrderBookLevel(
    BigDecimal price,
    BigDecimal quantity
) {
    public OrderBookLevel {
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
        if (quantity == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price cannot be negative");
        }
        if (quantity.signum() < 0) {
            throw new IllegalArgumentException("quantity cannot be negative");
        }
    }
}

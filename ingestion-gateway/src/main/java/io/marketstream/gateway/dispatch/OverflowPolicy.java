package io.marketstream.gateway.dispatch;

/**
 * What happens when a consumer's queue is full.
 */
public enum OverflowPolicy {
    /** Evict the oldest queued event to make room. Publishing never blocks. */
    DROP_OLDEST,
    /** Wait up to the publish timeout for room, then drop the new event. */
    BACKPRESSURE;

    public static OverflowPolicy fromString(String value) {
        return switch (value.trim().toLowerCase().replace('-', '_')) {
            case "drop_oldest", "drop" -> DROP_OLDEST;
            case "backpressure", "block" -> BACKPRESSURE;
            default -> throw new IllegalArgumentException("Unknown overflow policy: " + value);
        };
    }
}

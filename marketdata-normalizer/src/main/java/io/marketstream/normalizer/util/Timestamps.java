package io.marketstream.normalizer.util;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalizes exchange timestamps to milliseconds since epoch.
 *
 * <p>The unit is inferred from magnitude: below 10^11 seconds, below 10^14
 * milliseconds, below 10^17 microseconds, otherwise nanoseconds.
 */
public final class Timestamps {

    private static final long SECONDS_LIMIT = 100_000_000_000L;
    private static final long MILLIS_LIMIT = 100_000_000_000_000L;
    private static final long MICROS_LIMIT = 100_000_000_000_000_000L;

    private Timestamps() {
    }

    public static long toEpochMillis(long value) {
        if (value < SECONDS_LIMIT) {
            return value * 1_000L;
        }
        if (value < MILLIS_LIMIT) {
            return value;
        }
        if (value < MICROS_LIMIT) {
            return value / 1_000L;
        }
        return value / 1_000_000L;
    }

    /**
     * Reads a numeric or textual timestamp.
     *
     * @return milliseconds since epoch, or {@code fallback} when the node is absent
     * @throws NumberFormatException if the text is not an integer
     */
    public static long toEpochMillis(JsonNode node, long fallback) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return fallback;
        }
        if (node.isNumber()) {
            return toEpochMillis(node.longValue());
        }
        String text = node.asText();
        if (text.isBlank()) {
            return fallback;
        }
        return toEpochMillis(Long.parseLong(text.trim()));
    }
}

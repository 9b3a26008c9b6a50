package io.marketstream.normalizer.impl.kucoin;

import java.util.Map;

/**
 * Translation between canonical candle intervals ({@code 1m}, {@code 1H}, ...)
 * and KuCoin interval names ({@code 1min}, {@code 1hour}, ...).
 */
public final class KucoinIntervals {

    private static final Map<String, String> TO_KUCOIN = Map.of(
        "1m", "1min",
        "5m", "5min",
        "15m", "15min",
        "30m", "30min",
        "1H", "1hour",
        "4H", "4hour",
        "1D", "1day",
        "1W", "1week"
    );

    private static final Map<String, String> FROM_KUCOIN = Map.of(
        "1min", "1m",
        "5min", "5m",
        "15min", "15m",
        "30min", "30m",
        "1hour", "1H",
        "4hour", "4H",
        "1day", "1D",
        "1week", "1W"
    );

    private KucoinIntervals() {
    }

    /**
     * @throws IllegalArgumentException for an interval KuCoin does not stream
     */
    public static String toKucoin(String interval) {
        String mapped = TO_KUCOIN.get(interval);
        if (mapped == null) {
            throw new IllegalArgumentException("Unsupported candle interval: " + interval);
        }
        return mapped;
    }

    /**
     * Unknown KuCoin names pass through unchanged.
     */
    public static String fromKucoin(String interval) {
        return FROM_KUCOIN.getOrDefault(interval, interval);
    }
}

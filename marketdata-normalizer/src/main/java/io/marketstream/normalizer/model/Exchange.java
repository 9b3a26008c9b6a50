package io.marketstream.normalizer.model;

/**
 * Supported cryptocurrency exchanges.
 */
public enum Exchange {
    BITGET("Bitget"),
    KUCOIN("KuCoin");

    private final String displayName;

    Exchange(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}

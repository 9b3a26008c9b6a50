package io.marketstream.gateway.core;

/**
 * Lifecycle state of one connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    SUBSCRIBING,
    STREAMING,
    CLOSING;

    /**
     * Gauge value exported for this state.
     */
    public int code() {
        return ordinal();
    }
}

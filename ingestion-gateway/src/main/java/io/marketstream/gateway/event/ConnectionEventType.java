package io.marketstream.gateway.event;

/**
 * Lifecycle notifications published alongside market events.
 */
public enum ConnectionEventType {
    CONNECTED,
    DISCONNECTED,
    SUBSCRIPTION_ACKED,
    SUBSCRIPTION_FAILED,
    FATAL_ERROR
}

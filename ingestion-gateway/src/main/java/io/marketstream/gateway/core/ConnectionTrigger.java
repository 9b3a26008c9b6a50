package io.marketstream.gateway.core;

/**
 * Inputs to {@link ConnectionStateMachine}.
 */
public enum ConnectionTrigger {
    /** Caller asked the connection to start. */
    START,
    /** Backoff delay elapsed. */
    RETRY_DUE,
    /** Token-gated exchange: fetch a token before dialing. */
    AUTH_REQUIRED,
    /** Token fetched. */
    AUTH_ACQUIRED,
    /** Transport reported the socket open. */
    TRANSPORT_OPENED,
    /** Desired subscriptions were sent. */
    SUBSCRIPTIONS_REPLAYED,
    /** Socket closed, errored, or did not open in time; token fetch failed. */
    CONNECTION_LOST,
    /** No inbound traffic for longer than twice the keepalive interval. */
    STALE,
    /** Token about to expire on a healthy connection. */
    TOKEN_EXPIRING,
    /** Caller asked the connection to stop. */
    STOP,
    /** Socket released after a stop. */
    CLOSED,
    /** Retry budget exhausted. */
    FATAL
}

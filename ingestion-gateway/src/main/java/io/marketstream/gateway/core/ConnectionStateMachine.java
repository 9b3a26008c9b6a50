package io.marketstream.gateway.core;

import static io.marketstream.gateway.core.ConnectionState.AUTHENTICATING;
import static io.marketstream.gateway.core.ConnectionState.CLOSING;
import static io.marketstream.gateway.core.ConnectionState.CONNECTING;
import static io.marketstream.gateway.core.ConnectionState.DISCONNECTED;
import static io.marketstream.gateway.core.ConnectionState.STREAMING;
import static io.marketstream.gateway.core.ConnectionState.SUBSCRIBING;

/**
 * Transition function of the connection lifecycle.
 *
 * <pre>
 * DISCONNECTED --START/RETRY_DUE--> CONNECTING --AUTH_REQUIRED--> AUTHENTICATING --AUTH_ACQUIRED--> CONNECTING
 * CONNECTING --TRANSPORT_OPENED--> SUBSCRIBING --SUBSCRIPTIONS_REPLAYED--> STREAMING
 * STREAMING --CONNECTION_LOST/STALE/TOKEN_EXPIRING--> CONNECTING
 * CONNECTING/AUTHENTICATING/SUBSCRIBING --CONNECTION_LOST--> DISCONNECTED
 * any --STOP--> CLOSING --CLOSED--> DISCONNECTED, any --FATAL--> DISCONNECTED
 * </pre>
 */
public final class ConnectionStateMachine {

    private ConnectionStateMachine() {
    }

    /**
     * @throws IllegalStateException if {@code trigger} is not valid in {@code state}
     */
    public static ConnectionState transition(ConnectionState state, ConnectionTrigger trigger) {
        ConnectionState next = switch (trigger) {
            case START, RETRY_DUE -> state == DISCONNECTED ? CONNECTING : null;
            case AUTH_REQUIRED -> state == CONNECTING ? AUTHENTICATING : null;
            case AUTH_ACQUIRED -> state == AUTHENTICATING ? CONNECTING : null;
            case TRANSPORT_OPENED -> state == CONNECTING ? SUBSCRIBING : null;
            case SUBSCRIPTIONS_REPLAYED -> state == SUBSCRIBING ? STREAMING : null;
            case CONNECTION_LOST -> switch (state) {
                case STREAMING -> CONNECTING;
                case CONNECTING, AUTHENTICATING, SUBSCRIBING -> DISCONNECTED;
                default -> null;
            };
            case STALE, TOKEN_EXPIRING -> state == STREAMING ? CONNECTING : null;
            case STOP -> CLOSING;
            case CLOSED -> state == CLOSING ? DISCONNECTED : null;
            case FATAL -> DISCONNECTED;
        };
        if (next == null) {
            throw new IllegalStateException("Invalid transition: " + trigger + " in state " + state);
        }
        return next;
    }

    /**
     * Whether {@code trigger} is accepted in {@code state}.
     */
    public static boolean canTransition(ConnectionState state, ConnectionTrigger trigger) {
        try {
            transition(state, trigger);
            return true;
        } catch (IllegalStateException e) {
            return false;
        }
    }
}

package io.marketstream.normalizer.model;

/**
 * Kinds of protocol-control messages.
 */
public enum ControlKind {
    /** Server greeting after the socket opens. */
    WELCOME,
    /** Positive acknowledgment of a subscribe or login request. */
    ACK,
    /** Acknowledgment of an unsubscribe request. */
    UNSUBSCRIBED,
    /** Negative acknowledgment of a request. */
    NACK,
    /** Keepalive reply. */
    PONG,
    /** Payload that could not be mapped to a known shape. */
    PROTOCOL_ERROR
}

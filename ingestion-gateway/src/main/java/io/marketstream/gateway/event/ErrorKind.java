package io.marketstream.gateway.event;

/**
 * Failure classification.
 */
public enum ErrorKind {
    /** Socket error, close, staleness or open timeout; retried with backoff. */
    TRANSPORT,
    /** Token or credential acquisition failed; retried with backoff. */
    AUTH,
    /** The exchange rejected one subscription; the connection is unaffected. */
    SUBSCRIPTION,
    /** A message could not be mapped; the connection stays up. */
    PROTOCOL,
    /** Retry budget exhausted or invalid configuration; the connection stops. */
    FATAL
}

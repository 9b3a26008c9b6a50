package io.marketstream.gateway.auth;

/**
 * Raised when connection credentials or a token cannot be obtained.
 * The connection treats it as a retryable authentication failure.
 */
public class HandshakeException extends Exception {

    public HandshakeException(String message) {
        super(message);
    }

    public HandshakeException(String message, Throwable cause) {
        super(message, cause);
    }
}

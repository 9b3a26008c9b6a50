package io.marketstream.gateway.auth;

/**
 * Supplies what the transport needs to open a connection.
 */
public interface HandshakeProvider {

    /**
     * Returns connection parameters. Safe to call before every (re)connect.
     * May block on network I/O.
     *
     * @throws HandshakeException if the parameters cannot be obtained
     */
    ConnectionAuth acquire() throws HandshakeException;

    /**
     * Whether {@link #acquire()} fetches a token (and the connection passes
     * through an authenticating phase).
     */
    boolean tokenGated();
}

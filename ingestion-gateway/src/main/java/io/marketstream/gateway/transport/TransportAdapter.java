package io.marketstream.gateway.transport;

import io.marketstream.gateway.auth.ConnectionAuth;

/**
 * Opens raw streaming sockets. Never retries and never owns connection state:
 * failures are reported to the listener and the caller decides what happens next.
 */
public interface TransportAdapter extends AutoCloseable {

    /**
     * Starts opening a socket to {@link ConnectionAuth#socketUri()}.
     * The outcome is reported asynchronously through the listener.
     */
    TransportHandle open(ConnectionAuth auth, TransportListener listener);

    /**
     * Releases I/O resources. Handles opened earlier stop working.
     */
    @Override
    void close();
}

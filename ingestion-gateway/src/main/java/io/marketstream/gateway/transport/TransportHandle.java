package io.marketstream.gateway.transport;

/**
 * One open (or opening) socket.
 */
public interface TransportHandle extends AutoCloseable {

    /**
     * Sends a text frame.
     *
     * @return false if the socket is not open and nothing was written
     */
    boolean send(String payload);

    boolean isOpen();

    /**
     * Closes the socket. Idempotent.
     */
    @Override
    void close();
}

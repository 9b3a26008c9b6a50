package io.marketstream.gateway.transport;

/**
 * Receiver of transport callbacks. Invoked on the transport's I/O thread.
 */
public interface TransportListener {

    /**
     * The WebSocket handshake completed.
     */
    void onOpen();

    /**
     * A text frame arrived.
     */
    void onMessage(String message);

    /**
     * The socket is gone. Delivered at most once per handle.
     *
     * @param code   WebSocket close code, 1006 when the socket dropped without a close frame
     * @param reason Close reason or a short description of the failure
     */
    void onClosed(int code, String reason);

    /**
     * A transport error occurred. Usually followed by {@link #onClosed}.
     */
    void onError(Throwable cause);
}

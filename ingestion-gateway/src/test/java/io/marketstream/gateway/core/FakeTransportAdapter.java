package io.marketstream.gateway.core;

import io.marketstream.gateway.auth.ConnectionAuth;
import io.marketstream.gateway.transport.TransportAdapter;
import io.marketstream.gateway.transport.TransportHandle;
import io.marketstream.gateway.transport.TransportListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Transport that records every socket it is asked to open. Tests drive the sockets by hand.
 */
final class FakeTransportAdapter implements TransportAdapter {

    final List<FakeHandle> handles = new ArrayList<>();
    boolean closed;

    @Override
    public TransportHandle open(ConnectionAuth auth, TransportListener listener) {
        FakeHandle handle = new FakeHandle(auth, listener);
        handles.add(handle);
        return handle;
    }

    FakeHandle last() {
        return handles.get(handles.size() - 1);
    }

    int openCount() {
        return handles.size();
    }

    @Override
    public void close() {
        closed = true;
    }

    static final class FakeHandle implements TransportHandle {
        final ConnectionAuth auth;
        final TransportListener listener;
        final List<String> sent = new ArrayList<>();
        boolean open;
        boolean closed;

        private FakeHandle(ConnectionAuth auth, TransportListener listener) {
            this.auth = auth;
            this.listener = listener;
        }

        void opened() {
            open = true;
            listener.onOpen();
        }

        void receive(String message) {
            listener.onMessage(message);
        }

        void drop(int code, String reason) {
            open = false;
            listener.onClosed(code, reason);
        }

        void fail(Throwable cause) {
            open = false;
            listener.onError(cause);
            listener.onClosed(1006, "connection lost");
        }

        @Override
        public boolean send(String payload) {
            if (!open) {
                return false;
            }
            sent.add(payload);
            return true;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
            closed = true;
        }
    }
}

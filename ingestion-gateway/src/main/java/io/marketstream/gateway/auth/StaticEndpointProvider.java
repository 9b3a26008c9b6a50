package io.marketstream.gateway.auth;

import java.net.URI;

/**
 * Provider for exchanges whose public feed needs no handshake.
 */
public class StaticEndpointProvider implements HandshakeProvider {

    private final ConnectionAuth auth;

    public StaticEndpointProvider(URI endpoint) {
        this.auth = ConnectionAuth.publicEndpoint(endpoint);
    }

    @Override
    public ConnectionAuth acquire() {
        return auth;
    }

    @Override
    public boolean tokenGated() {
        return false;
    }
}

package io.marketstream.gateway.auth;

import java.net.URI;

/**
 * Everything the transport needs to open a socket.
 *
 * @param endpoint       Base WebSocket endpoint
 * @param token          Connection token, null for public feeds
 * @param connectId      Client connection id sent with the token, or null
 * @param expiresAt      Token expiry in milliseconds since epoch, 0 when the endpoint never expires
 * @param pingIntervalMs Server-advertised keepalive interval, 0 to use the exchange default
 */
public record ConnectionAuth(
    URI endpoint,
    String token,
    String connectId,
    long expiresAt,
    long pingIntervalMs
) {
    /**
     * Tokens are treated as expired this long before their actual expiry.
     */
    public static final long EXPIRY_MARGIN_MS = 60_000L;

    public ConnectionAuth {
        if (endpoint == null) {
            throw new IllegalArgumentException("endpoint cannot be null");
        }
        if (expiresAt < 0) {
            throw new IllegalArgumentException("expiresAt cannot be negative");
        }
        if (pingIntervalMs < 0) {
            throw new IllegalArgumentException("pingIntervalMs cannot be negative");
        }
    }

    /**
     * Auth for a plain public endpoint.
     */
    public static ConnectionAuth publicEndpoint(URI endpoint) {
        return new ConnectionAuth(endpoint, null, null, 0L, 0L);
    }

    public boolean expires() {
        return expiresAt > 0;
    }

    /**
     * @return true if the token expires within {@code marginMs} of {@code nowMs}
     */
    public boolean isExpired(long nowMs, long marginMs) {
        return expires() && nowMs >= expiresAt - marginMs;
    }

    /**
     * The URI to dial: the endpoint with {@code token} and {@code connectId} appended when present.
     */
    public URI socketUri() {
        if (token == null) {
            return endpoint;
        }
        StringBuilder uri = new StringBuilder(endpoint.toString());
        uri.append(endpoint.getRawQuery() == null ? '?' : '&');
        uri.append("token=").append(token);
        if (connectId != null) {
            uri.append("&connectId=").append(connectId);
        }
        return URI.create(uri.toString());
    }

    @Override
    public String toString() {
        return "ConnectionAuth[endpoint=" + endpoint
            + ", token=" + (token == null ? "none" : "***")
            + ", connectId=" + connectId
            + ", expiresAt=" + expiresAt
            + ", pingIntervalMs=" + pingIntervalMs + "]";
    }
}

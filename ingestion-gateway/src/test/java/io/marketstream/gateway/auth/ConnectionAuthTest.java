package io.marketstream.gateway.auth;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionAuth.
 */
class ConnectionAuthTest {

    private static final URI ENDPOINT = URI.create("wss://ws-api-spot.kucoin.com/");

    @Test
    void testPublicEndpointUriUnchanged() {
        ConnectionAuth auth = ConnectionAuth.publicEndpoint(URI.create("wss://ws.bitget.com/v2/ws/public"));

        assertEquals(URI.create("wss://ws.bitget.com/v2/ws/public"), auth.socketUri());
        assertFalse(auth.expires());
        assertFalse(auth.isExpired(Long.MAX_VALUE, ConnectionAuth.EXPIRY_MARGIN_MS));
    }

    @Test
    void testSocketUriCarriesTokenAndConnectId() {
        ConnectionAuth auth = new ConnectionAuth(ENDPOINT, "abc", "conn-1", 1_000_000L, 18_000L);

        assertEquals(URI.create("wss://ws-api-spot.kucoin.com/?token=abc&connectId=conn-1"), auth.socketUri());
    }

    @Test
    void testSocketUriAppendsToExistingQuery() {
        ConnectionAuth auth = new ConnectionAuth(URI.create("wss://host/endpoint?compress=false"), "abc", null, 0L, 0L);

        assertEquals(URI.create("wss://host/endpoint?compress=false&token=abc"), auth.socketUri());
    }

    @Test
    void testExpiryMargin() {
        ConnectionAuth auth = new ConnectionAuth(ENDPOINT, "abc", "conn-1", 1_000_000L, 0L);

        assertFalse(auth.isExpired(939_999L, 60_000L));
        assertTrue(auth.isExpired(940_000L, 60_000L));
    }

    @Test
    void testToStringHidesToken() {
        ConnectionAuth auth = new ConnectionAuth(ENDPOINT, "very-secret-token", "conn-1", 1L, 0L);

        assertFalse(auth.toString().contains("very-secret-token"));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionAuth(null, null, null, 0L, 0L));
    }
}

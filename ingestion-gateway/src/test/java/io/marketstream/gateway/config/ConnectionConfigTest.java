package io.marketstream.gateway.config;

import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionConfig.
 */
class ConnectionConfigTest {

    @Test
    void testParseWithSubscriptions() {
        ConnectionConfig config = ConnectionConfig.fromString("bitget:futures:true:BTCUSDT/ticker, BTCUSDT/candle1m");

        assertEquals(Exchange.BITGET, config.exchange());
        assertEquals(MarketType.FUTURES, config.marketType());
        assertTrue(config.enabled());
        assertEquals(List.of(new SubscriptionKey("BTCUSDT", "ticker"), new SubscriptionKey("BTCUSDT", "candle1m")),
            config.subscriptions());
    }

    @Test
    void testParseSpotSymbolWithDash() {
        ConnectionConfig config = ConnectionConfig.fromString("KUCOIN:spot:false:BTC-USDT/ticker");

        assertEquals(Exchange.KUCOIN, config.exchange());
        assertEquals(MarketType.SPOT, config.marketType());
        assertFalse(config.enabled());
        assertEquals(List.of(new SubscriptionKey("BTC-USDT", "ticker")), config.subscriptions());
    }

    @Test
    void testParseWithoutSubscriptions() {
        ConnectionConfig config = ConnectionConfig.fromString("kucoin:futures:true");

        assertTrue(config.subscriptions().isEmpty());
    }

    @Test
    void testInvalidEntriesRejected() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionConfig.fromString("bitget:futures"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionConfig.fromString("binance:spot:true"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionConfig.fromString("bitget:options:true"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionConfig.fromString("bitget:spot:true:BTCUSDT"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionConfig.fromString("bitget:spot:true:BTCUSDT/"));
    }
}

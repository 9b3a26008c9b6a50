package io.marketstream.gateway.config;

import io.marketstream.gateway.core.BackoffPolicy;
import io.marketstream.gateway.dispatch.OverflowPolicy;
import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GatewayConfig.
 */
class GatewayConfigTest {

    @Test
    void testDefaultsFromEmptyEnvironment() {
        GatewayConfig config = GatewayConfig.fromEnv(key -> null);

        assertEquals("gateway-0", config.gatewayId());
        assertEquals(2, config.connections().size());
        assertEquals(Exchange.BITGET, config.connections().get(0).exchange());
        assertEquals(Exchange.KUCOIN, config.connections().get(1).exchange());
        assertEquals(BackoffPolicy.defaults(), config.backoffPolicy());
        assertEquals(OverflowPolicy.DROP_OLDEST, config.dispatchOverflowPolicy());
        assertEquals(10_000, config.dispatchQueueCapacity());
        assertEquals(9090, config.metricsPort());
        assertFalse(config.logEvents());
    }

    @Test
    void testEnvironmentOverrides() {
        Map<String, String> env = Map.of(
            "GATEWAY_ID", "ingest-7",
            "CONNECTIONS", "kucoin:spot:true:BTC-USDT/ticker,ETH-USDT/trade",
            "RECONNECT_BASE_DELAY_MS", "500",
            "RECONNECT_MAX_DELAY_MS", "8000",
            "RECONNECT_MULTIPLIER", "2.0",
            "RECONNECT_MAX_RETRIES", "4",
            "DISPATCH_OVERFLOW_POLICY", "backpressure",
            "DISPATCH_PUBLISH_TIMEOUT_MS", "250",
            "METRICS_PORT", "0",
            "LOG_EVENTS", "true"
        );

        GatewayConfig config = GatewayConfig.fromEnv(env::get);

        assertEquals("ingest-7", config.gatewayId());
        assertEquals(1, config.connections().size());
        assertEquals(MarketType.SPOT, config.connections().get(0).marketType());
        assertEquals(new SubscriptionKey("ETH-USDT", "trade"), config.connections().get(0).subscriptions().get(1));
        assertEquals(new BackoffPolicy(500, 2.0, 8000, 4), config.backoffPolicy());
        assertEquals(OverflowPolicy.BACKPRESSURE, config.dispatchOverflowPolicy());
        assertEquals(250, config.dispatchPublishTimeoutMs());
        assertEquals(0, config.metricsPort());
        assertTrue(config.logEvents());
    }

    @Test
    void testInvalidNumbersFallBackToDefaults() {
        Map<String, String> env = Map.of(
            "RECONNECT_MAX_RETRIES", "many",
            "RECONNECT_MULTIPLIER", "fast",
            "DISPATCH_OVERFLOW_POLICY", "sometimes"
        );

        GatewayConfig config = GatewayConfig.fromEnv(env::get);

        assertEquals(BackoffPolicy.DEFAULT_MAX_RETRIES, config.reconnectMaxRetries());
        assertEquals(BackoffPolicy.DEFAULT_MULTIPLIER, config.reconnectMultiplier());
        assertEquals(OverflowPolicy.DROP_OLDEST, config.dispatchOverflowPolicy());
    }

    @Test
    void testBuilder() {
        GatewayConfig config = GatewayConfig.builder()
            .gatewayId("test")
            .addConnection(Exchange.BITGET, MarketType.SPOT, new SubscriptionKey("BTCUSDT", "trade"))
            .reconnect(200, 1.5, 2000, 2)
            .dispatch(16, OverflowPolicy.BACKPRESSURE, 5)
            .metricsPort(0)
            .build();

        assertEquals("test", config.gatewayId());
        assertEquals(1, config.connections().size());
        assertTrue(config.connections().get(0).enabled());
        assertEquals(2, config.backoffPolicy().maxRetries());
        assertEquals(16, config.dispatchQueueCapacity());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.builder().gatewayId("").build());
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.builder().metricsPort(70000).build());
        assertThrows(IllegalArgumentException.class,
            () -> GatewayConfig.builder().dispatch(0, OverflowPolicy.DROP_OLDEST, 0).build());
        assertThrows(IllegalArgumentException.class,
            () -> GatewayConfig.builder().reconnect(1000, 0.5, 2000, 1).build());
    }
}

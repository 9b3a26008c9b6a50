package io.marketstream.gateway.exchange.kucoin;

import io.marketstream.gateway.exchange.SubscriptionRequest;
import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.normalizer.model.MarketType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KucoinProtocol.
 */
class KucoinProtocolTest {

    private final KucoinProtocol futures = new KucoinProtocol(MarketType.FUTURES);
    private final KucoinProtocol spot = new KucoinProtocol(MarketType.SPOT);

    @Test
    void testSubscribeOneFramePerTopic() {
        List<SubscriptionRequest> requests = futures.subscribe(List.of(
            new SubscriptionKey("XBTUSDTM", "ticker"),
            new SubscriptionKey("XBTUSDTM", "trade")
        ));

        assertEquals(2, requests.size());
        assertEquals(
            "{\"id\":\"1\",\"type\":\"subscribe\",\"topic\":\"/contractMarket/ticker:XBTUSDTM\",\"privateChannel\":false,\"response\":true}",
            requests.get(0).payload());
        assertEquals("1", requests.get(0).requestId());
        assertEquals("2", requests.get(1).requestId());
        assertEquals(List.of(new SubscriptionKey("XBTUSDTM", "trade")), requests.get(1).keys());
    }

    @Test
    void testUnsubscribe() {
        SubscriptionRequest request = spot.unsubscribe(List.of(new SubscriptionKey("BTC-USDT", "level2"))).get(0);

        assertEquals(
            "{\"id\":\"1\",\"type\":\"unsubscribe\",\"topic\":\"/market/level2:BTC-USDT\",\"privateChannel\":false,\"response\":true}",
            request.payload());
    }

    @Test
    void testPing() {
        assertEquals("{\"id\":\"7\",\"type\":\"ping\"}", futures.pingPayload("7"));
        assertTrue(futures.correlatesPings());
        assertEquals(18_000, futures.keepaliveIntervalMs());
    }

    @Test
    void testFuturesTopics() {
        assertEquals("/contractMarket/ticker:XBTUSDTM", futures.topic(new SubscriptionKey("XBTUSDTM", "ticker")));
        assertEquals("/contractMarket/tickerV2:XBTUSDTM", futures.topic(new SubscriptionKey("XBTUSDTM", "tickerV2")));
        assertEquals("/contractMarket/execution:XBTUSDTM", futures.topic(new SubscriptionKey("XBTUSDTM", "trade")));
        assertEquals("/contractMarket/execution:XBTUSDTM", futures.topic(new SubscriptionKey("XBTUSDTM", "execution")));
        assertEquals("/contractMarket/level2:XBTUSDTM", futures.topic(new SubscriptionKey("XBTUSDTM", "level2")));
        assertEquals("/contractMarket/limitCandle:XBTUSDTM_1hour", futures.topic(new SubscriptionKey("XBTUSDTM", "candle1H")));
        assertEquals("/contractMarket/level2Depth5:XBTUSDTM", futures.topic(new SubscriptionKey("XBTUSDTM", "level2Depth5")));
    }

    @Test
    void testSpotTopics() {
        assertEquals("/market/ticker:BTC-USDT", spot.topic(new SubscriptionKey("BTC-USDT", "ticker")));
        assertEquals("/market/match:BTC-USDT", spot.topic(new SubscriptionKey("BTC-USDT", "trade")));
        assertEquals("/market/match:BTC-USDT", spot.topic(new SubscriptionKey("BTC-USDT", "match")));
        assertEquals("/market/level2:BTC-USDT", spot.topic(new SubscriptionKey("BTC-USDT", "level2")));
        assertEquals("/market/candles:BTC-USDT_1min", spot.topic(new SubscriptionKey("BTC-USDT", "candle1m")));
        assertEquals("/market/candles:BTC-USDT_1week", spot.topic(new SubscriptionKey("BTC-USDT", "candle1W")));
        assertEquals("/market/snapshot:BTC-USDT", spot.topic(new SubscriptionKey("BTC-USDT", "snapshot")));
    }

    @Test
    void testUnknownIntervalRejected() {
        assertThrows(IllegalArgumentException.class, () -> spot.validate(new SubscriptionKey("BTC-USDT", "candle7m")));
        spot.validate(new SubscriptionKey("BTC-USDT", "candle4H"));
    }
}

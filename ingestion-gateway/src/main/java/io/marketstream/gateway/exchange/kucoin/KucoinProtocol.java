package io.marketstream.gateway.exchange.kucoin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketstream.gateway.exchange.ExchangeProtocol;
import io.marketstream.gateway.exchange.SubscriptionRequest;
import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.normalizer.impl.kucoin.KucoinIntervals;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * KuCoin spot and futures WebSocket protocol.
 *
 * Subscribe: {@code {"id":"1","type":"subscribe","topic":"/contractMarket/ticker:XBTUSDTM","privateChannel":false,"response":true}},
 * one frame per topic, acknowledged by {@code {"id":"1","type":"ack"}}.
 * Keepalive: {@code {"id":"2","type":"ping"}} answered by a pong with the same id.
 */
public class KucoinProtocol implements ExchangeProtocol {

    static final long KEEPALIVE_INTERVAL_MS = 18_000L;
    private static final String CANDLE_PREFIX = "candle";

    private final MarketType marketType;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong requestIds = new AtomicLong();

    public KucoinProtocol(MarketType marketType) {
        this.marketType = marketType;
    }

    @Override
    public Exchange exchange() {
        return Exchange.KUCOIN;
    }

    @Override
    public MarketType marketType() {
        return marketType;
    }

    @Override
    public long keepaliveIntervalMs() {
        return KEEPALIVE_INTERVAL_MS;
    }

    @Override
    public String nextRequestId() {
        return Long.toString(requestIds.incrementAndGet());
    }

    @Override
    public String pingPayload(String pingId) {
        ObjectNode ping = objectMapper.createObjectNode()
            .put("id", pingId)
            .put("type", "ping");
        return write(ping);
    }

    @Override
    public boolean correlatesPings() {
        return true;
    }

    @Override
    public List<SubscriptionRequest> subscribe(List<SubscriptionKey> keys) {
        return requests("subscribe", keys);
    }

    @Override
    public List<SubscriptionRequest> unsubscribe(List<SubscriptionKey> keys) {
        return requests("unsubscribe", keys);
    }

    @Override
    public void validate(SubscriptionKey key) {
        topic(key);
    }

    @Override
    public String wireSymbol(String symbol) {
        return symbol;
    }

    /**
     * Maps a canonical channel to a KuCoin topic.
     *
     * @throws IllegalArgumentException for a candle interval KuCoin does not offer
     */
    public String topic(SubscriptionKey key) {
        String symbol = key.symbol();
        String channel = key.channel();
        boolean futures = marketType == MarketType.FUTURES;

        if (channel.startsWith(CANDLE_PREFIX) && channel.length() > CANDLE_PREFIX.length()) {
            String interval = KucoinIntervals.toKucoin(channel.substring(CANDLE_PREFIX.length()));
            return futures
                ? "/contractMarket/limitCandle:" + symbol + "_" + interval
                : "/market/candles:" + symbol + "_" + interval;
        }

        if (futures) {
            return switch (channel) {
                case "ticker" -> "/contractMarket/ticker:" + symbol;
                case "tickerV2" -> "/contractMarket/tickerV2:" + symbol;
                case "trade", "execution" -> "/contractMarket/execution:" + symbol;
                case "level2" -> "/contractMarket/level2:" + symbol;
                default -> "/contractMarket/" + channel + ":" + symbol;
            };
        }
        return switch (channel) {
            case "ticker" -> "/market/ticker:" + symbol;
            case "trade", "match" -> "/market/match:" + symbol;
            case "level2" -> "/market/level2:" + symbol;
            default -> "/market/" + channel + ":" + symbol;
        };
    }

    private List<SubscriptionRequest> requests(String type, List<SubscriptionKey> keys) {
        List<SubscriptionRequest> requests = new ArrayList<>(keys.size());
        for (SubscriptionKey key : keys) {
            String id = nextRequestId();
            ObjectNode frame = objectMapper.createObjectNode()
                .put("id", id)
                .put("type", type)
                .put("topic", topic(key))
                .put("privateChannel", false)
                .put("response", true);
            requests.add(new SubscriptionRequest(write(frame), id, List.of(key)));
        }
        return requests;
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}

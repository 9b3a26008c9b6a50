package io.marketstream.gateway.exchange.bitget;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketstream.gateway.exchange.ExchangeProtocol;
import io.marketstream.gateway.exchange.SubscriptionRequest;
import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;

import java.io.UncheckedIOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bitget v2 public WebSocket protocol.
 *
 * Subscribe: {@code {"op":"subscribe","args":[{"instType":"USDT-FUTURES","channel":"ticker","instId":"BTCUSDT"}]}}.
 * Acks carry the arg back, so no request ids are used. Keepalive is the bare text {@code ping}.
 */
public class BitgetProtocol implements ExchangeProtocol {

    public static final URI PUBLIC_ENDPOINT = URI.create("wss://ws.bitget.com/v2/ws/public");
    public static final URI PRIVATE_ENDPOINT = URI.create("wss://ws.bitget.com/v2/ws/private");

    static final long KEEPALIVE_INTERVAL_MS = 30_000L;
    private static final String PING = "ping";

    private final MarketType marketType;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong requestIds = new AtomicLong();

    public BitgetProtocol(MarketType marketType) {
        this.marketType = marketType;
    }

    @Override
    public Exchange exchange() {
        return Exchange.BITGET;
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
        return PING;
    }

    @Override
    public boolean correlatesPings() {
        return false;
    }

    @Override
    public List<SubscriptionRequest> subscribe(List<SubscriptionKey> keys) {
        return keys.isEmpty() ? List.of() : List.of(request("subscribe", keys));
    }

    @Override
    public List<SubscriptionRequest> unsubscribe(List<SubscriptionKey> keys) {
        return keys.isEmpty() ? List.of() : List.of(request("unsubscribe", keys));
    }

    /**
     * Strips legacy product suffixes such as {@code _UMCBL} or {@code _SPBL}.
     */
    @Override
    public String wireSymbol(String symbol) {
        int separator = symbol.indexOf('_');
        return separator > 0 ? symbol.substring(0, separator) : symbol;
    }

    String instType() {
        return marketType == MarketType.FUTURES ? "USDT-FUTURES" : "SPOT";
    }

    private SubscriptionRequest request(String op, List<SubscriptionKey> keys) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("op", op);
        ArrayNode args = root.putArray("args");
        for (SubscriptionKey key : keys) {
            args.addObject()
                .put("instType", instType())
                .put("channel", key.channel())
                .put("instId", wireSymbol(key.symbol()));
        }
        try {
            return new SubscriptionRequest(objectMapper.writeValueAsString(root), null, keys);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}

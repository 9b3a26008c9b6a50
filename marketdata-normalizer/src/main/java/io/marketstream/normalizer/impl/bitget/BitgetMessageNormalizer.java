package io.marketstream.normalizer.impl.bitget;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketstream.normalizer.api.MessageNormalizer;
import io.marketstream.normalizer.model.Candle;
import io.marketstream.normalizer.model.Control;
import io.marketstream.normalizer.model.ControlKind;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketEvent;
import io.marketstream.normalizer.model.OrderBookDelta;
import io.marketstream.normalizer.model.OrderBookLevel;
import io.marketstream.normalizer.model.Side;
import io.marketstream.normalizer.model.Ticker;
import io.marketstream.normalizer.model.Trade;
import io.marketstream.normalizer.util.Decimals;
import io.marketstream.normalizer.util.JsonSupport;
import io.marketstream.normalizer.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static io.marketstream.normalizer.util.JsonSupport.text;

/**
 * Normalizer for the Bitget v2 public WebSocket API.
 *
 * Data push format:
 * <pre>
 * {"action":"snapshot","arg":{"instType":"USDT-FUTURES","channel":"ticker","instId":"BTCUSDT"},
 *  "data":[{"instId":"BTCUSDT","lastPr":"88650",...,"ts":"1732200000000"}],"ts":1732200000001}
 * </pre>
 * Control format: {@code {"event":"subscribe","arg":{...}}}, {@code {"event":"error","code":30001,"msg":"..."}}
 * and the bare text {@code pong}.
 */
public class BitgetMessageNormalizer implements MessageNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BitgetMessageNormalizer.class);

    public static final String CHANNEL_TICKER = "ticker";
    public static final String CHANNEL_TRADE = "trade";
    public static final String CHANNEL_CANDLE_PREFIX = "candle";
    public static final String CHANNEL_BOOKS_PREFIX = "books";

    private static final String PONG = "pong";
    private static final String ACTION_SNAPSHOT = "snapshot";

    private final ObjectMapper objectMapper = JsonSupport.newObjectMapper();

    @Override
    public Exchange exchange() {
        return Exchange.BITGET;
    }

    @Override
    public List<MarketEvent> normalize(String message, long receivedAt) {
        if (message == null || message.isBlank()) {
            return List.of(Control.protocolError(Exchange.BITGET, receivedAt, "empty payload", message));
        }
        if (PONG.equals(message.trim())) {
            return List.of(control(ControlKind.PONG, null, null, receivedAt, receivedAt, null, null, message));
        }

        try {
            JsonNode root = objectMapper.readTree(message);
            if (root == null || !root.isObject()) {
                return List.of(Control.protocolError(Exchange.BITGET, receivedAt, "payload is not a JSON object", message));
            }
            if (root.has("event")) {
                return List.of(parseEvent(root, message, receivedAt));
            }
            return parseData(root, message, receivedAt);
        } catch (Exception e) {
            LOGGER.debug("Bitget payload rejected: {}", e.getMessage());
            return List.of(Control.protocolError(Exchange.BITGET, receivedAt, "unparseable payload: " + e.getMessage(), message));
        }
    }

    private MarketEvent parseEvent(JsonNode root, String raw, long receivedAt) {
        String event = text(root, "event");
        JsonNode arg = root.get("arg");
        String channel = arg != null ? text(arg, "channel") : null;
        String instId = arg != null ? text(arg, "instId") : null;
        String code = text(root, "code");
        String msg = text(root, "msg");

        return switch (event) {
            case "subscribe" -> control(ControlKind.ACK, instId, channel, receivedAt, receivedAt, code, msg, raw);
            case "unsubscribe" -> control(ControlKind.UNSUBSCRIBED, instId, channel, receivedAt, receivedAt, code, msg, raw);
            case "login" -> control(ControlKind.ACK, null, "login", receivedAt, receivedAt, code, msg, raw);
            case "error" -> channel != null
                ? control(ControlKind.NACK, instId, channel, receivedAt, receivedAt, code, msg, raw)
                : new Control(Exchange.BITGET, null, receivedAt, receivedAt, ControlKind.PROTOCOL_ERROR,
                    null, null, code, msg, raw);
            default -> Control.protocolError(Exchange.BITGET, receivedAt, "unknown event: " + event, raw);
        };
    }

    private List<MarketEvent> parseData(JsonNode root, String raw, long receivedAt) {
        JsonNode arg = root.get("arg");
        JsonNode data = root.get("data");
        if (arg == null || data == null || !data.isArray()) {
            return List.of(Control.protocolError(Exchange.BITGET, receivedAt, "unrecognized message shape", raw));
        }

        String channel = text(arg, "channel");
        String instId = text(arg, "instId");
        if (channel == null || instId == null) {
            return List.of(Control.protocolError(Exchange.BITGET, receivedAt, "missing channel or instId", raw));
        }

        long fallbackTs = Timestamps.toEpochMillis(root.get("ts"), receivedAt);
        boolean snapshot = ACTION_SNAPSHOT.equals(text(root, "action"));

        if (CHANNEL_TICKER.equals(channel)) {
            return parseTickers(data, instId, fallbackTs, receivedAt);
        } else if (CHANNEL_TRADE.equals(channel)) {
            return parseTrades(data, instId, fallbackTs, receivedAt);
        } else if (channel.startsWith(CHANNEL_CANDLE_PREFIX)) {
            String interval = channel.substring(CHANNEL_CANDLE_PREFIX.length());
            return parseCandles(data, instId, interval, receivedAt);
        } else if (channel.startsWith(CHANNEL_BOOKS_PREFIX)) {
            return parseBooks(data, instId, snapshot, fallbackTs, receivedAt);
        }
        return List.of(Control.protocolError(Exchange.BITGET, receivedAt, "unsupported channel: " + channel, raw));
    }

    private List<MarketEvent> parseTickers(JsonNode data, String instId, long fallbackTs, long receivedAt) {
        List<MarketEvent> events = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            String symbol = item.hasNonNull("instId") ? item.get("instId").asText() : instId;
            events.add(new Ticker(
                Exchange.BITGET,
                symbol,
                Timestamps.toEpochMillis(item.get("ts"), fallbackTs),
                receivedAt,
                Decimals.parse(item.get("lastPr")),
                Decimals.parse(item.get("bidPr")),
                Decimals.parse(item.get("askPr")),
                Decimals.parse(item.get("bidSz")),
                Decimals.parse(item.get("askSz")),
                Decimals.parse(item.get("high24h")),
                Decimals.parse(item.get("low24h")),
                Decimals.parse(item.get("baseVolume")),
                Decimals.parse(item.get("change24h"))
            ));
        }
        return events;
    }

    private List<MarketEvent> parseTrades(JsonNode data, String instId, long fallbackTs, long receivedAt) {
        List<MarketEvent> events = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            events.add(new Trade(
                Exchange.BITGET,
                instId,
                Timestamps.toEpochMillis(item.get("ts"), fallbackTs),
                receivedAt,
                text(item, "tradeId") != null ? text(item, "tradeId") : "",
                Decimals.require(item.get("price"), "price"),
                Decimals.require(item.get("size"), "size"),
                Side.fromString(text(item, "side"))
            ));
        }
        return events;
    }

    /**
     * Rows are {@code [ts, open, high, low, close, baseVolume, quoteVolume, usdtVolume]}.
     */
    private List<MarketEvent> parseCandles(JsonNode data, String instId, String interval, long receivedAt) {
        List<MarketEvent> events = new ArrayList<>(data.size());
        for (JsonNode row : data) {
            if (!row.isArray() || row.size() < 6) {
                throw new IllegalArgumentException("candle row must have at least 6 columns");
            }
            events.add(new Candle(
                Exchange.BITGET,
                instId,
                Timestamps.toEpochMillis(row.get(0), receivedAt),
                receivedAt,
                interval,
                Decimals.require(row.get(1), "open"),
                Decimals.require(row.get(2), "high"),
                Decimals.require(row.get(3), "low"),
                Decimals.require(row.get(4), "close"),
                Decimals.require(row.get(5), "baseVolume"),
                row.size() > 6 ? Decimals.parse(row.get(6)) : null
            ));
        }
        return events;
    }

    private List<MarketEvent> parseBooks(JsonNode data, String instId, boolean snapshot, long fallbackTs, long receivedAt) {
        List<MarketEvent> events = new ArrayList<>(data.size());
        for (JsonNode item : data) {
            JsonNode seq = item.get("seq");
            events.add(new OrderBookDelta(
                Exchange.BITGET,
                instId,
                Timestamps.toEpochMillis(item.get("ts"), fallbackTs),
                receivedAt,
                parseLevels(item.get("bids")),
                parseLevels(item.get("asks")),
                snapshot,
                seq != null && !seq.isNull() ? Long.parseLong(seq.asText()) : 0L
            ));
        }
        return events;
    }

    private List<OrderBookLevel> parseLevels(JsonNode levels) {
        if (levels == null || !levels.isArray()) {
            return List.of();
        }
        List<OrderBookLevel> result = new ArrayList<>(levels.size());
        for (JsonNode level : levels) {
            result.add(new OrderBookLevel(
                Decimals.require(level.get(0), "price"),
                Decimals.require(level.get(1), "size")
            ));
        }
        return result;
    }

    private static Control control(ControlKind kind, String symbol, String channel, long timestamp,
                                   long receivedAt, String code, String message, String raw) {
        return new Control(Exchange.BITGET, symbol, timestamp, receivedAt, kind, channel, null, code, message, raw);
    }
}

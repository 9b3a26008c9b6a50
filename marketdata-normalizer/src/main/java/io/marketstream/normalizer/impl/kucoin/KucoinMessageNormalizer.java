package io.marketstream.normalizer.impl.kucoin;

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
 * Normalizer for KuCoin spot and futures WebSocket feeds.
 *
 * Envelope: {@code {"type":"message","topic":"/contractMarket/ticker:XBTUSDTM","subject":"ticker","data":{...}}}.
 * Control frames are {@code welcome}, {@code ack}, {@code pong} and {@code error}, each with an {@code id}.
 */
public class KucoinMessageNormalizer implements MessageNormalizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(KucoinMessageNormalizer.class);

    private final ObjectMapper objectMapper = JsonSupport.newObjectMapper();

    @Override
    public Exchange exchange() {
        return Exchange.KUCOIN;
    }

    @Override
    public List<MarketEvent> normalize(String message, long receivedAt) {
        if (message == null || message.isBlank()) {
            return List.of(Control.protocolError(Exchange.KUCOIN, receivedAt, "empty payload", message));
        }

        try {
            JsonNode root = objectMapper.readTree(message);
            if (root == null || !root.isObject()) {
                return List.of(Control.protocolError(Exchange.KUCOIN, receivedAt, "payload is not a JSON object", message));
            }

            String type = text(root, "type");
            if (type == null) {
                return List.of(Control.protocolError(Exchange.KUCOIN, receivedAt, "missing type", message));
            }
            String id = text(root, "id");

            return switch (type) {
                case "welcome" -> List.of(control(ControlKind.WELCOME, id, null, null, receivedAt, message));
                case "ack" -> List.of(control(ControlKind.ACK, id, null, null, receivedAt, message));
                case "pong" -> List.of(new Control(Exchange.KUCOIN, null,
                    Timestamps.toEpochMillis(root.get("timestamp"), receivedAt), receivedAt,
                    ControlKind.PONG, null, id, null, null, message));
                case "error" -> List.of(control(ControlKind.NACK, id, text(root, "code"), text(root, "data"), receivedAt, message));
                case "message" -> parseMessage(root, message, receivedAt);
                default -> List.of(Control.protocolError(Exchange.KUCOIN, receivedAt, "unknown type: " + type, message));
            };
        } catch (Exception e) {
            LOGGER.debug("KuCoin payload rejected: {}", e.getMessage());
            return List.of(Control.protocolError(Exchange.KUCOIN, receivedAt, "unparseable payload: " + e.getMessage(), message));
        }
    }

    private List<MarketEvent> parseMessage(JsonNode root, String raw, long receivedAt) {
        String topic = text(root, "topic");
        String subject = text(root, "subject");
        JsonNode data = root.get("data");
        if (topic == null || subject == null || data == null || !data.isObject()) {
            return List.of(Control.protocolError(Exchange.KUCOIN, receivedAt, "incomplete message envelope", raw));
        }
        String topicSuffix = topicSuffix(topic);

        return switch (subject) {
            case "ticker", "tickerV2" -> List.of(futuresTicker(data, topicSuffix, receivedAt));
            case "trade.ticker" -> List.of(spotTicker(data, topicSuffix, receivedAt));
            case "match", "trade.l3match" -> List.of(trade(data, topicSuffix, receivedAt));
            case "level2" -> List.of(futuresLevel2(data, topicSuffix, receivedAt));
            case "trade.l2update" -> List.of(spotLevel2(data, topicSuffix, receivedAt));
            case "candle.stick", "trade.candles.update" -> List.of(candle(data, topicSuffix, receivedAt));
            default -> List.of(Control.protocolError(Exchange.KUCOIN, receivedAt, "unsupported subject: " + subject, raw));
        };
    }

    private Ticker futuresTicker(JsonNode data, String topicSuffix, long receivedAt) {
        return new Ticker(
            Exchange.KUCOIN,
            symbol(data, topicSuffix),
            Timestamps.toEpochMillis(data.get("ts"), receivedAt),
            receivedAt,
            Decimals.parse(data.get("price")),
            Decimals.parse(data.get("bestBidPrice")),
            Decimals.parse(data.get("bestAskPrice")),
            Decimals.parse(data.get("bestBidSize")),
            Decimals.parse(data.get("bestAskSize")),
            null,
            null,
            null,
            null
        );
    }

    private Ticker spotTicker(JsonNode data, String topicSuffix, long receivedAt) {
        return new Ticker(
            Exchange.KUCOIN,
            symbol(data, topicSuffix),
            Timestamps.toEpochMillis(data.get("time"), receivedAt),
            receivedAt,
            Decimals.parse(data.get("price")),
            Decimals.parse(data.get("bestBid")),
            Decimals.parse(data.get("bestAsk")),
            Decimals.parse(data.get("bestBidSize")),
            Decimals.parse(data.get("bestAskSize")),
            null,
            null,
            null,
            null
        );
    }

    private Trade trade(JsonNode data, String topicSuffix, long receivedAt) {
        // futures carry "ts", spot carries "time"; both may be nanoseconds
        JsonNode ts = data.hasNonNull("ts") ? data.get("ts") : data.get("time");
        String tradeId = text(data, "tradeId");
        return new Trade(
            Exchange.KUCOIN,
            symbol(data, topicSuffix),
            Timestamps.toEpochMillis(ts, receivedAt),
            receivedAt,
            tradeId != null ? tradeId : "",
            Decimals.require(data.get("price"), "price"),
            Decimals.require(data.get("size"), "size"),
            Side.fromString(text(data, "side"))
        );
    }

    /**
     * Futures level2 carries a single change as {@code "price,side,size"}.
     */
    private OrderBookDelta futuresLevel2(JsonNode data, String topicSuffix, long receivedAt) {
        String change = text(data, "change");
        if (change == null) {
            throw new IllegalArgumentException("missing change");
        }
        String[] parts = change.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("malformed change: " + change);
        }
        OrderBookLevel level = new OrderBookLevel(Decimals.parse(parts[0]), Decimals.parse(parts[2]));
        Side side = Side.fromString(parts[1].trim());
        if (side == Side.UNKNOWN) {
            throw new IllegalArgumentException("unknown side in change: " + change);
        }
        return new OrderBookDelta(
            Exchange.KUCOIN,
            symbol(data, topicSuffix),
            Timestamps.toEpochMillis(data.get("timestamp"), receivedAt),
            receivedAt,
            side == Side.BUY ? List.of(level) : List.of(),
            side == Side.SELL ? List.of(level) : List.of(),
            false,
            data.path("sequence").asLong(0L)
        );
    }

    private OrderBookDelta spotLevel2(JsonNode data, String topicSuffix, long receivedAt) {
        JsonNode changes = data.get("changes");
        if (changes == null || !changes.isObject()) {
            throw new IllegalArgumentException("missing changes");
        }
        return new OrderBookDelta(
            Exchange.KUCOIN,
            symbol(data, topicSuffix),
            Timestamps.toEpochMillis(data.get("time"), receivedAt),
            receivedAt,
            parseLevels(changes.get("bids")),
            parseLevels(changes.get("asks")),
            false,
            data.path("sequenceEnd").asLong(0L)
        );
    }

    /**
     * Rows are {@code [time(s), open, close, high, low, volume, turnover]}.
     */
    private Candle candle(JsonNode data, String topicSuffix, long receivedAt) {
        JsonNode row = data.get("candles");
        if (row == null || !row.isArray() || row.size() < 6) {
            throw new IllegalArgumentException("candles must have at least 6 columns");
        }
        int separator = topicSuffix.lastIndexOf('_');
        if (separator <= 0) {
            throw new IllegalArgumentException("candle topic without interval: " + topicSuffix);
        }
        String topicSymbol = topicSuffix.substring(0, separator);
        String interval = KucoinIntervals.fromKucoin(topicSuffix.substring(separator + 1));

        return new Candle(
            Exchange.KUCOIN,
            symbol(data, topicSymbol),
            Timestamps.toEpochMillis(row.get(0), receivedAt),
            receivedAt,
            interval,
            Decimals.require(row.get(1), "open"),
            Decimals.require(row.get(3), "high"),
            Decimals.require(row.get(4), "low"),
            Decimals.require(row.get(2), "close"),
            Decimals.require(row.get(5), "volume"),
            row.size() > 6 ? Decimals.parse(row.get(6)) : null
        );
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

    private static String symbol(JsonNode data, String fallback) {
        String symbol = text(data, "symbol");
        return symbol != null ? symbol : fallback;
    }

    private static String topicSuffix(String topic) {
        int colon = topic.indexOf(':');
        return colon >= 0 ? topic.substring(colon + 1) : topic;
    }

    private static Control control(ControlKind kind, String requestId, String code, String message,
                                   long receivedAt, String raw) {
        return new Control(Exchange.KUCOIN, null, receivedAt, receivedAt, kind, null, requestId, code, message, raw);
    }
}

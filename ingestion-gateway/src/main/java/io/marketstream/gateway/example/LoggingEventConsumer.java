package io.marketstream.gateway.example;

import io.marketstream.gateway.dispatch.EventConsumer;
import io.marketstream.gateway.event.ConnectionEvent;
import io.marketstream.normalizer.model.Candle;
import io.marketstream.normalizer.model.Control;
import io.marketstream.normalizer.model.OrderBookDelta;
import io.marketstream.normalizer.model.StreamEvent;
import io.marketstream.normalizer.model.Ticker;
import io.marketstream.normalizer.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Example consumer that logs every event it receives.
 *
 * Enabled with {@code LOG_EVENTS=true}. Market data is logged at debug,
 * connection lifecycle at info.
 */
public class LoggingEventConsumer implements EventConsumer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingEventConsumer.class);

    private final AtomicLong marketEventCount = new AtomicLong(0);
    private final AtomicLong connectionEventCount = new AtomicLong(0);

    @Override
    public void onEvent(StreamEvent event) {
        if (event instanceof ConnectionEvent connectionEvent) {
            connectionEventCount.incrementAndGet();
            LOGGER.info("[{}] {} {}{}",
                connectionEvent.connectionId().name(),
                connectionEvent.type(),
                connectionEvent.subscription() != null ? connectionEvent.subscription() + " " : "",
                connectionEvent.message() != null ? connectionEvent.message() : "");
            return;
        }

        marketEventCount.incrementAndGet();
        if (event instanceof Ticker ticker) {
            LOGGER.debug("{} TICKER {} last={} bid={} ask={}",
                ticker.exchange(), ticker.symbol(), ticker.lastPrice(), ticker.bidPrice(), ticker.askPrice());
        } else if (event instanceof Trade trade) {
            LOGGER.debug("{} TRADE {} {} {}@{}",
                trade.exchange(), trade.symbol(), trade.side(), trade.quantity(), trade.price());
        } else if (event instanceof Candle candle) {
            LOGGER.debug("{} CANDLE {} {} o={} h={} l={} c={} v={}",
                candle.exchange(), candle.symbol(), candle.interval(),
                candle.open(), candle.high(), candle.low(), candle.close(), candle.volume());
        } else if (event instanceof OrderBookDelta book) {
            LOGGER.debug("{} BOOK {} {} bids={} asks={} seq={}",
                book.exchange(), book.symbol(), book.snapshot() ? "snapshot" : "update",
                book.bids().size(), book.asks().size(), book.sequence());
        } else if (event instanceof Control control) {
            LOGGER.warn("{} {} {}", control.exchange(), control.kind(), control.message());
        }
    }

    public long getMarketEventCount() {
        return marketEventCount.get();
    }

    public long getConnectionEventCount() {
        return connectionEventCount.get();
    }
}

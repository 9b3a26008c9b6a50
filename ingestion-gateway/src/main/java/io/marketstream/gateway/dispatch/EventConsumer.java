package io.marketstream.gateway.dispatch;

import io.marketstream.normalizer.model.StreamEvent;

/**
 * Downstream receiver of market and connection events.
 * Called from the consumer's own worker thread, one event at a time.
 */
@FunctionalInterface
public interface EventConsumer {

    void onEvent(StreamEvent event);
}

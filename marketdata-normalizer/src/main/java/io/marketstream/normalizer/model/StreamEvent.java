package io.marketstream.normalizer.model;

/**
 * Anything delivered to stream consumers: canonical market events and
 * connection lifecycle notifications.
 */
public interface StreamEvent {

    /**
     * Exchange the event originates from.
     */
    Exchange exchange();

    /**
     * Local receipt time in milliseconds since epoch.
     */
    long receivedAt();
}

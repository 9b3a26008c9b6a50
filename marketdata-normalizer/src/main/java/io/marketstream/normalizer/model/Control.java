package io.marketstream.normalizer.model;

/**
 * Protocol-control message (welcome, ack, nack, pong) or a diagnostic for an
 * unmappable payload.
 *
 * @param exchange   The exchange identifier
 * @param symbol     Instrument the message refers to, or null
 * @param timestamp  Exchange timestamp in milliseconds, or the receive time when absent
 * @param receivedAt Local receive timestamp in milliseconds
 * @param kind       Control kind
 * @param channel    Channel the message refers to, or null
 * @param requestId  Correlation id of the originating request, or null
 * @param code       Exchange error code, or null
 * @param message    Human-readable detail, or null
 * @param rawPayload Original payload, kept for diagnostics
 */
public record Control(
    Exchange exchange,
    String symbol,
    long timestamp,
    long receivedAt,
    ControlKind kind,
    String channel,
    String requestId,
    String code,
    String message,
    String rawPayload
) implements MarketEvent {
    public Control {
        if (exchange == null) {
            throw new IllegalArgumentException("exchange cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    /**
     * Creates a diagnostic event for a payload that could not be normalized.
     */
    public static Control protocolError(Exchange exchange, long receivedAt, String message, String rawPayload) {
        return new Control(exchange, null, receivedAt, receivedAt, ControlKind.PROTOCOL_ERROR,
            null, null, null, message, rawPayload);
    }

    @Override
    public EventType type() {
        return EventType.CONTROL;
    }
}

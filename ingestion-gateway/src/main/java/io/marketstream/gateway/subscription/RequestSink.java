package io.marketstream.gateway.subscription;

/**
 * Where subscription requests are written while connected.
 */
@FunctionalInterface
public interface RequestSink {

    /**
     * @return false if the payload could not be written
     */
    boolean send(String payload);
}

package io.marketstream.gateway.subscription;

import io.marketstream.gateway.exchange.ExchangeProtocol;
import io.marketstream.gateway.exchange.SubscriptionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Desired and confirmed subscriptions of one connection.
 *
 * <p>Callers mutate the desired set; exchange acknowledgments mutate the confirmed
 * set. While connected, mutations are sent at once; otherwise they wait for
 * {@link #onReconnected}, which replays the whole desired set once.
 * All operations are linearized by one lock and may be called from any thread.
 */
public class SubscriptionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionManager.class);

    private final String name;
    private final ExchangeProtocol protocol;
    private final Object lock = new Object();

    private final Set<SubscriptionKey> desired = new LinkedHashSet<>();
    private final Set<SubscriptionKey> confirmed = new LinkedHashSet<>();
    private final Map<String, List<SubscriptionKey>> pendingByRequestId = new HashMap<>();

    private RequestSink sink;

    public SubscriptionManager(String name, ExchangeProtocol protocol) {
        this.name = name;
        this.protocol = protocol;
    }

    /**
     * Adds a pair to the desired set.
     *
     * @return false if the pair was already desired (nothing is sent)
     * @throws IllegalArgumentException if the exchange cannot encode the pair
     */
    public boolean add(String symbol, String channel) {
        SubscriptionKey key = new SubscriptionKey(symbol, channel);
        protocol.validate(key);
        synchronized (lock) {
            if (!desired.add(key)) {
                LOGGER.debug("[{}] {} already desired", name, key);
                return false;
            }
            if (sink != null) {
                send(protocol.subscribe(List.of(key)), true);
            }
            LOGGER.info("[{}] Added subscription {} ({})", name, key, sink != null ? "sent" : "queued");
            return true;
        }
    }

    /**
     * Removes a pair from the desired set.
     *
     * @return false if the pair was not desired (nothing is sent)
     */
    public boolean remove(String symbol, String channel) {
        SubscriptionKey key = new SubscriptionKey(symbol, channel);
        synchronized (lock) {
            if (!desired.remove(key)) {
                LOGGER.debug("[{}] {} not desired, nothing to remove", name, key);
                return false;
            }
            confirmed.remove(key);
            pendingByRequestId.values().forEach(keys -> keys.remove(key));
            if (sink != null) {
                send(protocol.unsubscribe(List.of(key)), false);
            }
            LOGGER.info("[{}] Removed subscription {}", name, key);
            return true;
        }
    }

    public Set<SubscriptionKey> desiredSet() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(desired));
        }
    }

    public Set<SubscriptionKey> confirmedSet() {
        synchronized (lock) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(confirmed));
        }
    }

    public boolean isConnected() {
        synchronized (lock) {
            return sink != null;
        }
    }

    /**
     * Binds the live socket and replays the desired set.
     *
     * @return number of pairs replayed
     */
    public int onReconnected(RequestSink requestSink) {
        synchronized (lock) {
            this.sink = requestSink;
            confirmed.clear();
            pendingByRequestId.clear();
            if (!desired.isEmpty()) {
                send(protocol.subscribe(new ArrayList<>(desired)), true);
            }
            LOGGER.info("[{}] Replayed {} subscriptions", name, desired.size());
            return desired.size();
        }
    }

    /**
     * Unbinds the socket. Confirmations are forgotten; the desired set is kept.
     */
    public void onDisconnected() {
        synchronized (lock) {
            sink = null;
            confirmed.clear();
            pendingByRequestId.clear();
        }
    }

    /**
     * Confirms the desired pair the exchange acknowledged by symbol and channel.
     *
     * @return the newly confirmed pair, empty if it was not desired or already confirmed
     */
    public Optional<SubscriptionKey> onAck(String symbol, String channel) {
        synchronized (lock) {
            Optional<SubscriptionKey> key = findDesired(symbol, channel);
            return key.filter(confirmed::add);
        }
    }

    /**
     * Drops a rejected pair from the desired set so it is not replayed again.
     *
     * @return the dropped pair, empty if it was not desired
     */
    public Optional<SubscriptionKey> onNack(String symbol, String channel) {
        synchronized (lock) {
            Optional<SubscriptionKey> key = findDesired(symbol, channel);
            key.ifPresent(this::drop);
            return key;
        }
    }

    /**
     * Confirms the pairs of an acknowledged request.
     *
     * @return the pairs newly confirmed; empty for unknown ids
     */
    public List<SubscriptionKey> onRequestAck(String requestId) {
        synchronized (lock) {
            List<SubscriptionKey> keys = requestId != null ? pendingByRequestId.remove(requestId) : null;
            if (keys == null) {
                return List.of();
            }
            List<SubscriptionKey> acked = new ArrayList<>(keys.size());
            for (SubscriptionKey key : keys) {
                if (desired.contains(key) && confirmed.add(key)) {
                    acked.add(key);
                }
            }
            return acked;
        }
    }

    /**
     * Drops the pairs of a rejected request from the desired set.
     *
     * @return the dropped pairs; empty for unknown ids
     */
    public List<SubscriptionKey> onRequestError(String requestId) {
        synchronized (lock) {
            List<SubscriptionKey> keys = requestId != null ? pendingByRequestId.remove(requestId) : null;
            if (keys == null) {
                return List.of();
            }
            List<SubscriptionKey> failed = new ArrayList<>(keys.size());
            for (SubscriptionKey key : keys) {
                if (desired.contains(key)) {
                    drop(key);
                    failed.add(key);
                }
            }
            return failed;
        }
    }

    private void drop(SubscriptionKey key) {
        desired.remove(key);
        confirmed.remove(key);
    }

    private Optional<SubscriptionKey> findDesired(String symbol, String channel) {
        if (symbol == null || channel == null) {
            return Optional.empty();
        }
        for (SubscriptionKey key : desired) {
            if (key.channel().equals(channel) && protocol.wireSymbol(key.symbol()).equals(symbol)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }

    private void send(List<SubscriptionRequest> requests, boolean track) {
        for (SubscriptionRequest request : requests) {
            if (track && request.requestId() != null) {
                pendingByRequestId.put(request.requestId(), new ArrayList<>(request.keys()));
            }
            if (!sink.send(request.payload())) {
                LOGGER.warn("[{}] Failed to send request for {}; will replay on reconnect", name, request.keys());
            }
        }
    }
}

package io.marketstream.gateway.core;

import io.marketstream.gateway.auth.ConnectionAuth;
import io.marketstream.gateway.auth.HandshakeException;
import io.marketstream.gateway.auth.HandshakeProvider;
import io.marketstream.gateway.event.ConnectionEvent;
import io.marketstream.gateway.event.ErrorKind;
import io.marketstream.gateway.exchange.ExchangeProtocol;
import io.marketstream.gateway.metrics.GatewayMetrics;
import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.gateway.subscription.SubscriptionManager;
import io.marketstream.gateway.transport.TransportAdapter;
import io.marketstream.gateway.transport.TransportHandle;
import io.marketstream.gateway.transport.TransportListener;
import io.marketstream.normalizer.api.MessageNormalizer;
import io.marketstream.normalizer.model.Control;
import io.marketstream.normalizer.model.MarketEvent;
import io.marketstream.normalizer.model.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Owns the lifecycle of one streaming connection.
 *
 * <p>Drives {@link ConnectionStateMachine}: acquires connection parameters, opens the
 * transport, replays subscriptions, sends keepalives, detects stale sockets and
 * reconnects with {@link BackoffPolicy}. Token-gated connections are re-established
 * before the token expires without consuming retry budget.
 *
 * <p>All state is confined to the connection's {@link TaskScheduler}; transport
 * callbacks are re-posted onto it and callbacks from superseded sockets are ignored
 * by generation number.
 */
public class ReconnectSupervisor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectSupervisor.class);

    static final long OPEN_TIMEOUT_MS = 10_000;
    private static final int MAX_LOGGED_PAYLOAD = 256;

    private final ConnectionId id;
    private final String name;
    private final ExchangeProtocol protocol;
    private final HandshakeProvider handshake;
    private final TransportAdapter transport;
    private final MessageNormalizer normalizer;
    private final SubscriptionManager subscriptions;
    private final Consumer<StreamEvent> publisher;
    private final BackoffPolicy backoffPolicy;
    private final TaskScheduler scheduler;
    private final GatewayMetrics metrics;

    private final BackoffState backoff = new BackoffState();
    private final AtomicLong messageCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean fatal;
    private volatile long lastActivityAt;
    private volatile long lastPingAt;
    private volatile int retryAttempts;
    private volatile boolean stopRequested;

    private int generation;
    private TransportHandle handle;
    private ConnectionAuth auth;
    private long keepaliveIntervalMs;
    private long streamingSince;
    private String pendingPingId;
    private boolean stopped;

    private TaskScheduler.Cancellable retryTask;
    private TaskScheduler.Cancellable openTimeoutTask;
    private TaskScheduler.Cancellable keepaliveTask;
    private TaskScheduler.Cancellable tokenRefreshTask;

    public ReconnectSupervisor(
        ConnectionId id,
        ExchangeProtocol protocol,
        HandshakeProvider handshake,
        TransportAdapter transport,
        MessageNormalizer normalizer,
        SubscriptionManager subscriptions,
        Consumer<StreamEvent> publisher,
        BackoffPolicy backoffPolicy,
        TaskScheduler scheduler,
        GatewayMetrics metrics
    ) {
        this.id = id;
        this.name = id.name();
        this.protocol = protocol;
        this.handshake = handshake;
        this.transport = transport;
        this.normalizer = normalizer;
        this.subscriptions = subscriptions;
        this.publisher = publisher;
        this.backoffPolicy = backoffPolicy;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.keepaliveIntervalMs = protocol.keepaliveIntervalMs();
        metrics.setConnectionState(id, state);
    }

    /**
     * Starts connecting. Ignored unless the connection is idle in {@link ConnectionState#DISCONNECTED};
     * after a fatal error this starts over with a fresh retry budget.
     */
    public void start() {
        scheduler.execute(this::doStart);
    }

    /**
     * Closes the socket and stays disconnected until {@link #start()} is called again.
     */
    public void stop() {
        // visible to a handshake already blocking the connection thread
        stopRequested = true;
        scheduler.execute(this::doStop);
    }

    /**
     * Stops the connection and releases its thread and transport.
     */
    @Override
    public void close() {
        stop();
        scheduler.close();
        if (state != ConnectionState.DISCONNECTED) {
            // the stop task did not get to run before the scheduler went down
            if (handle != null) {
                handle.close();
                handle = null;
            }
            subscriptions.onDisconnected();
            state = ConnectionState.DISCONNECTED;
            metrics.setConnectionState(id, state);
        }
        transport.close();
        LOGGER.info("[{}] Connection closed", name);
    }

    public ConnectionId id() {
        return id;
    }

    public ConnectionState state() {
        return state;
    }

    /**
     * True after the retry budget ran out, until the next {@link #start()}.
     */
    public boolean isFatal() {
        return fatal;
    }

    public boolean isStreaming() {
        return state == ConnectionState.STREAMING;
    }

    public SubscriptionManager subscriptions() {
        return subscriptions;
    }

    public long lastActivityAt() {
        return lastActivityAt;
    }

    /**
     * When the last keepalive was sent, 0 before the first one.
     */
    public long lastPingAt() {
        return lastPingAt;
    }

    public long messageCount() {
        return messageCount.get();
    }

    public long errorCount() {
        return errorCount.get();
    }

    public int retryAttempts() {
        return retryAttempts;
    }

    private void doStart() {
        if (state != ConnectionState.DISCONNECTED || retryTask != null) {
            LOGGER.debug("[{}] Start ignored in state {}", name, state);
            return;
        }
        stopped = false;
        fatal = false;
        resetBackoff();
        LOGGER.info("[{}] Starting connection", name);
        transition(ConnectionTrigger.START);
        connect();
    }

    private void doStop() {
        stopped = true;
        stopRequested = false;
        cancel(retryTask);
        retryTask = null;
        if (state == ConnectionState.DISCONNECTED) {
            return;
        }
        boolean wasConnected = state == ConnectionState.SUBSCRIBING || state == ConnectionState.STREAMING;
        transition(ConnectionTrigger.STOP);
        teardown();
        transition(ConnectionTrigger.CLOSED);
        if (wasConnected) {
            publisher.accept(ConnectionEvent.disconnected(id, scheduler.now(), null, "stopped"));
        }
        LOGGER.info("[{}] Connection stopped", name);
    }

    /**
     * Acquires connection parameters and dials. Runs in {@link ConnectionState#CONNECTING}.
     */
    private void connect() {
        final int gen = ++generation;
        final ConnectionAuth acquired;
        try {
            if (handshake.tokenGated()) {
                transition(ConnectionTrigger.AUTH_REQUIRED);
                acquired = handshake.acquire();
                transition(ConnectionTrigger.AUTH_ACQUIRED);
            } else {
                acquired = handshake.acquire();
            }
        } catch (HandshakeException | RuntimeException e) {
            if (stopped || stopRequested) {
                LOGGER.debug("[{}] Handshake abandoned on stop: {}", name, e.getMessage());
            } else {
                connectionLost(gen, ErrorKind.AUTH, "handshake failed: " + e.getMessage(), ConnectionTrigger.CONNECTION_LOST);
            }
            return;
        }

        auth = acquired;
        keepaliveIntervalMs = acquired.pingIntervalMs() > 0 ? acquired.pingIntervalMs() : protocol.keepaliveIntervalMs();
        LOGGER.info("[{}] Opening {}", name, acquired.endpoint());
        try {
            handle = transport.open(acquired, new HandleListener(gen));
        } catch (RuntimeException e) {
            connectionLost(gen, ErrorKind.TRANSPORT, "open failed: " + e.getMessage(), ConnectionTrigger.CONNECTION_LOST);
            return;
        }
        openTimeoutTask = scheduler.schedule(() -> onOpenTimeout(gen), OPEN_TIMEOUT_MS);
    }

    private void onOpen(int gen) {
        if (gen != generation || state != ConnectionState.CONNECTING) {
            return;
        }
        cancel(openTimeoutTask);
        openTimeoutTask = null;

        long now = scheduler.now();
        transition(ConnectionTrigger.TRANSPORT_OPENED);
        lastActivityAt = now;
        LOGGER.info("[{}] Connected", name);
        publisher.accept(ConnectionEvent.connected(id, now));

        TransportHandle live = handle;
        int replayed = subscriptions.onReconnected(live::send);
        transition(ConnectionTrigger.SUBSCRIPTIONS_REPLAYED);
        streamingSince = now;
        pendingPingId = null;
        LOGGER.info("[{}] Streaming ({} subscriptions requested, keepalive {} ms)", name, replayed, keepaliveIntervalMs);

        scheduleKeepalive(gen);
        scheduleTokenRefresh(gen);
    }

    private void onOpenTimeout(int gen) {
        if (gen == generation && state == ConnectionState.CONNECTING) {
            connectionLost(gen, ErrorKind.TRANSPORT, "open timed out after " + OPEN_TIMEOUT_MS + " ms",
                ConnectionTrigger.CONNECTION_LOST);
        }
    }

    private void onMessage(int gen, String message, long receivedAt) {
        if (gen != generation) {
            return;
        }
        if (state != ConnectionState.SUBSCRIBING && state != ConnectionState.STREAMING) {
            return;
        }
        lastActivityAt = receivedAt;
        messageCount.incrementAndGet();
        metrics.recordMessageSize(id.exchange(), message.length());

        long start = System.nanoTime();
        List<MarketEvent> events = normalizer.normalize(message, receivedAt);
        metrics.recordNormalizeLatency(id.exchange(), (System.nanoTime() - start) / 1000.0);

        for (MarketEvent event : events) {
            metrics.recordEventReceived(id.exchange(), event.type());
            if (event instanceof Control control) {
                onControl(control);
            } else {
                publisher.accept(event);
            }
        }
    }

    private void onControl(Control control) {
        long now = scheduler.now();
        switch (control.kind()) {
            case WELCOME -> LOGGER.debug("[{}] Welcome received", name);
            case ACK -> {
                List<SubscriptionKey> acked = control.requestId() != null
                    ? subscriptions.onRequestAck(control.requestId())
                    : subscriptions.onAck(control.symbol(), control.channel()).map(List::of).orElse(List.of());
                for (SubscriptionKey key : acked) {
                    LOGGER.info("[{}] Subscription confirmed: {}", name, key);
                    publisher.accept(ConnectionEvent.subscriptionAcked(id, now, key));
                }
                metrics.setActiveSubscriptions(id, subscriptions.confirmedSet().size());
            }
            case UNSUBSCRIBED -> LOGGER.debug("[{}] Unsubscribed: {} {}", name, control.symbol(), control.channel());
            case NACK -> {
                String reason = describe(control);
                List<SubscriptionKey> failed = control.requestId() != null
                    ? subscriptions.onRequestError(control.requestId())
                    : subscriptions.onNack(control.symbol(), control.channel()).map(List::of).orElse(List.of());
                if (failed.isEmpty()) {
                    LOGGER.warn("[{}] Request rejected: {}", name, reason);
                }
                for (SubscriptionKey key : failed) {
                    LOGGER.warn("[{}] Subscription rejected: {} ({})", name, key, reason);
                    metrics.recordConnectionError(id, ErrorKind.SUBSCRIPTION);
                    publisher.accept(ConnectionEvent.subscriptionFailed(id, now, key, reason));
                }
                metrics.setActiveSubscriptions(id, subscriptions.confirmedSet().size());
            }
            case PONG -> {
                if (protocol.correlatesPings() && pendingPingId != null && !pendingPingId.equals(control.requestId())) {
                    LOGGER.debug("[{}] Pong id {} does not match ping id {}", name, control.requestId(), pendingPingId);
                }
                pendingPingId = null;
            }
            case PROTOCOL_ERROR -> {
                errorCount.incrementAndGet();
                metrics.recordProtocolError(id.exchange());
                LOGGER.warn("[{}] Unmappable message: {} payload={}", name, describe(control), truncate(control.rawPayload()));
                publisher.accept(control);
            }
        }
    }

    private void onTransportFailure(int gen, String reason) {
        connectionLost(gen, ErrorKind.TRANSPORT, reason, ConnectionTrigger.CONNECTION_LOST);
    }

    private void connectionLost(int gen, ErrorKind kind, String reason, ConnectionTrigger trigger) {
        if (gen != generation || stopped) {
            return;
        }
        ConnectionState from = state;
        if (from == ConnectionState.DISCONNECTED || from == ConnectionState.CLOSING) {
            return;
        }

        teardown();
        errorCount.incrementAndGet();
        metrics.recordConnectionError(id, kind);
        LOGGER.warn("[{}] Connection lost in {}: {}", name, from, reason);
        publisher.accept(ConnectionEvent.disconnected(id, scheduler.now(), kind, reason));

        transition(from == ConnectionState.STREAMING ? trigger : ConnectionTrigger.CONNECTION_LOST);
        scheduleRetry(reason);
    }

    private void scheduleRetry(String reason) {
        int attempt = backoff.recordFailure();
        retryAttempts = attempt;
        if (backoffPolicy.isExhausted(attempt)) {
            fail("retry budget exhausted after " + backoffPolicy.maxRetries() + " retries, last error: " + reason);
            return;
        }
        long delay = backoffPolicy.delayFor(attempt);
        backoff.scheduleRetry(scheduler.now() + delay);
        metrics.recordReconnectAttempt(id);
        LOGGER.info("[{}] Reconnecting in {} ms (attempt {}/{})", name, delay, attempt, backoffPolicy.maxRetries());
        retryTask = scheduler.schedule(this::retry, delay);
    }

    private void retry() {
        retryTask = null;
        if (stopped) {
            return;
        }
        if (state == ConnectionState.DISCONNECTED) {
            transition(ConnectionTrigger.RETRY_DUE);
        } else if (state != ConnectionState.CONNECTING) {
            return;
        }
        connect();
    }

    private void fail(String reason) {
        transition(ConnectionTrigger.FATAL);
        fatal = true;
        metrics.recordFatalError(id);
        LOGGER.error("[{}] Giving up: {}", name, reason);
        publisher.accept(ConnectionEvent.fatal(id, scheduler.now(), reason));
    }

    private void scheduleKeepalive(int gen) {
        keepaliveTask = scheduler.schedule(() -> keepalive(gen), keepaliveIntervalMs);
    }

    private void keepalive(int gen) {
        if (gen != generation || state != ConnectionState.STREAMING) {
            return;
        }
        long now = scheduler.now();
        long silentFor = now - lastActivityAt;
        if (silentFor > 2 * keepaliveIntervalMs) {
            connectionLost(gen, ErrorKind.TRANSPORT, "stale: no traffic for " + silentFor + " ms", ConnectionTrigger.STALE);
            return;
        }

        if (backoff.attempts() > 0 && now - streamingSince > keepaliveIntervalMs) {
            LOGGER.info("[{}] Connection stable, resetting retry counter", name);
            resetBackoff();
        }

        String pingId = protocol.correlatesPings() ? protocol.nextRequestId() : null;
        pendingPingId = pingId;
        lastPingAt = now;
        if (!handle.send(protocol.pingPayload(pingId))) {
            LOGGER.debug("[{}] Keepalive not sent", name);
        }
        scheduleKeepalive(gen);
    }

    private void scheduleTokenRefresh(int gen) {
        if (auth == null || !auth.expires()) {
            return;
        }
        long delay = auth.expiresAt() - ConnectionAuth.EXPIRY_MARGIN_MS - scheduler.now();
        tokenRefreshTask = scheduler.schedule(() -> refreshToken(gen), Math.max(0, delay));
    }

    private void refreshToken(int gen) {
        if (gen != generation || state != ConnectionState.STREAMING) {
            return;
        }
        LOGGER.info("[{}] Token expiring, reconnecting with a fresh token", name);
        teardown();
        publisher.accept(ConnectionEvent.disconnected(id, scheduler.now(), null, "token refresh"));
        transition(ConnectionTrigger.TOKEN_EXPIRING);
        connect();
    }

    /**
     * Invalidates the current socket and everything scheduled for it.
     */
    private void teardown() {
        generation++;
        cancel(openTimeoutTask);
        cancel(keepaliveTask);
        cancel(tokenRefreshTask);
        openTimeoutTask = null;
        keepaliveTask = null;
        tokenRefreshTask = null;
        if (handle != null) {
            handle.close();
            handle = null;
        }
        pendingPingId = null;
        subscriptions.onDisconnected();
        metrics.setActiveSubscriptions(id, 0);
    }

    private void resetBackoff() {
        backoff.reset();
        retryAttempts = 0;
    }

    private void transition(ConnectionTrigger trigger) {
        ConnectionState next = ConnectionStateMachine.transition(state, trigger);
        LOGGER.debug("[{}] {} --{}--> {}", name, state, trigger, next);
        state = next;
        metrics.setConnectionState(id, next);
    }

    private static void cancel(TaskScheduler.Cancellable task) {
        if (task != null) {
            task.cancel();
        }
    }

    private static String describe(Control control) {
        StringBuilder text = new StringBuilder();
        if (control.code() != null) {
            text.append("code=").append(control.code()).append(' ');
        }
        text.append(control.message() != null ? control.message() : "no detail");
        return text.toString();
    }

    private static String truncate(String payload) {
        if (payload == null || payload.length() <= MAX_LOGGED_PAYLOAD) {
            return payload;
        }
        return payload.substring(0, MAX_LOGGED_PAYLOAD) + "...";
    }

    /**
     * Re-posts transport callbacks onto the connection thread, tagged with the socket's generation.
     */
    private final class HandleListener implements TransportListener {
        private final int gen;

        private HandleListener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen() {
            scheduler.execute(() -> ReconnectSupervisor.this.onOpen(gen));
        }

        @Override
        public void onMessage(String message) {
            long receivedAt = scheduler.now();
            scheduler.execute(() -> ReconnectSupervisor.this.onMessage(gen, message, receivedAt));
        }

        @Override
        public void onClosed(int code, String reason) {
            scheduler.execute(() -> onTransportFailure(gen, "closed (" + code + "): " + reason));
        }

        @Override
        public void onError(Throwable cause) {
            scheduler.execute(() -> onTransportFailure(gen, "transport error: " + cause));
        }
    }
}

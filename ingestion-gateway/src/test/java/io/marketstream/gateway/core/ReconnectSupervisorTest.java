package io.marketstream.gateway.core;

import io.marketstream.gateway.event.ConnectionEvent;
import io.marketstream.gateway.event.ConnectionEventType;
import io.marketstream.gateway.event.ErrorKind;
import io.marketstream.gateway.exchange.ExchangeProtocol;
import io.marketstream.gateway.exchange.bitget.BitgetProtocol;
import io.marketstream.gateway.exchange.kucoin.KucoinProtocol;
import io.marketstream.gateway.metrics.GatewayMetrics;
import io.marketstream.gateway.subscription.SubscriptionKey;
import io.marketstream.gateway.subscription.SubscriptionManager;
import io.marketstream.normalizer.api.MessageNormalizer;
import io.marketstream.normalizer.model.Control;
import io.marketstream.normalizer.model.ControlKind;
import io.marketstream.normalizer.model.Exchange;
import io.marketstream.normalizer.model.MarketType;
import io.marketstream.normalizer.model.StreamEvent;
import io.marketstream.normalizer.model.Ticker;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectSupervisor, driven without sockets.
 */
class ReconnectSupervisorTest {

    private static final long START = 1_732_200_000_000L;
    private static final ConnectionId BITGET_FUTURES = new ConnectionId(Exchange.BITGET, MarketType.FUTURES);
    private static final ConnectionId KUCOIN_FUTURES = new ConnectionId(Exchange.KUCOIN, MarketType.FUTURES);

    private static final String BITGET_SUBSCRIBE =
        "{\"op\":\"subscribe\",\"args\":[{\"instType\":\"USDT-FUTURES\",\"channel\":\"ticker\",\"instId\":\"BTCUSDT\"}]}";
    private static final String BITGET_ACK =
        "{\"event\":\"subscribe\",\"arg\":{\"instType\":\"USDT-FUTURES\",\"channel\":\"ticker\",\"instId\":\"BTCUSDT\"}}";
    private static final String BITGET_TICKER = """
        {"action":"snapshot","arg":{"instType":"USDT-FUTURES","channel":"ticker","instId":"BTCUSDT"},
         "data":[{"instId":"BTCUSDT","lastPr":"88650","ts":"1732200000000"}],"ts":1732200000001}
        """;

    private ManualScheduler scheduler;
    private FakeTransportAdapter transport;
    private FakeHandshakeProvider handshake;
    private GatewayMetrics metrics;
    private List<StreamEvent> events;
    private SubscriptionManager subscriptions;
    private ReconnectSupervisor supervisor;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler(START);
        transport = new FakeTransportAdapter();
        handshake = new FakeHandshakeProvider();
        metrics = new GatewayMetrics(new CollectorRegistry(), false);
        events = new ArrayList<>();
    }

    private ReconnectSupervisor create(ConnectionId id, ExchangeProtocol protocol, BackoffPolicy policy) {
        subscriptions = new SubscriptionManager(id.name(), protocol);
        supervisor = new ReconnectSupervisor(
            id,
            protocol,
            handshake,
            transport,
            MessageNormalizer.forExchange(id.exchange()),
            subscriptions,
            events::add,
            policy,
            scheduler,
            metrics
        );
        handshake.stateProbe = supervisor::state;
        return supervisor;
    }

    private ReconnectSupervisor bitget() {
        return create(BITGET_FUTURES, new BitgetProtocol(MarketType.FUTURES), BackoffPolicy.defaults());
    }

    private FakeTransportAdapter.FakeHandle startAndOpen() {
        supervisor.start();
        scheduler.runPending();
        FakeTransportAdapter.FakeHandle handle = transport.last();
        handle.opened();
        scheduler.runPending();
        return handle;
    }

    private List<ConnectionEvent> connectionEvents(ConnectionEventType type) {
        return events.stream()
            .filter(event -> event instanceof ConnectionEvent)
            .map(event -> (ConnectionEvent) event)
            .filter(event -> event.type() == type)
            .collect(Collectors.toList());
    }

    @Test
    void testStartOpensAndStreams() {
        bitget();

        supervisor.start();
        scheduler.runPending();

        assertEquals(ConnectionState.CONNECTING, supervisor.state());
        assertEquals(1, transport.openCount());
        assertEquals(FakeHandshakeProvider.ENDPOINT, transport.last().auth.socketUri());

        transport.last().opened();
        scheduler.runPending();

        assertEquals(ConnectionState.STREAMING, supervisor.state());
        assertEquals(1, connectionEvents(ConnectionEventType.CONNECTED).size());
        assertTrue(subscriptions.isConnected());
    }

    @Test
    void testSubscriptionsReplayedAfterReconnect() {
        bitget();
        assertTrue(subscriptions.add("BTCUSDT", "ticker"));

        FakeTransportAdapter.FakeHandle first = startAndOpen();
        assertEquals(List.of(BITGET_SUBSCRIBE), first.sent);

        first.receive(BITGET_ACK);
        scheduler.runPending();
        SubscriptionKey key = new SubscriptionKey("BTCUSDT", "ticker");
        assertEquals(Set.of(key), subscriptions.confirmedSet());

        first.drop(1006, "connection reset");
        scheduler.runPending();

        assertEquals(ConnectionState.CONNECTING, supervisor.state());
        assertTrue(first.closed);
        assertTrue(subscriptions.confirmedSet().isEmpty());
        ConnectionEvent disconnected = connectionEvents(ConnectionEventType.DISCONNECTED).get(0);
        assertEquals(ErrorKind.TRANSPORT, disconnected.errorKind());

        scheduler.advance(BackoffPolicy.DEFAULT_BASE_DELAY_MS);
        assertEquals(2, transport.openCount());

        FakeTransportAdapter.FakeHandle second = transport.last();
        second.opened();
        scheduler.runPending();
        assertEquals(List.of(BITGET_SUBSCRIBE), second.sent);

        second.receive(BITGET_ACK);
        scheduler.runPending();

        assertEquals(ConnectionState.STREAMING, supervisor.state());
        assertEquals(Set.of(key), subscriptions.confirmedSet());
        List<ConnectionEvent> acks = connectionEvents(ConnectionEventType.SUBSCRIPTION_ACKED);
        assertEquals(2, acks.size());
        assertEquals(key, acks.get(1).subscription());
    }

    @Test
    void testFatalAfterRetryBudget() {
        create(BITGET_FUTURES, new BitgetProtocol(MarketType.FUTURES), new BackoffPolicy(100, 2.0, 400, 3));

        supervisor.start();
        scheduler.runPending();
        transport.last().drop(1006, "connection refused");
        scheduler.runPending();
        assertEquals(ConnectionState.DISCONNECTED, supervisor.state());

        long[] expectedDelays = {100, 200, 400};
        for (int retry = 0; retry < expectedDelays.length; retry++) {
            int opened = transport.openCount();
            scheduler.advance(expectedDelays[retry] - 1);
            assertEquals(opened, transport.openCount(), "retry " + (retry + 1) + " fired early");
            scheduler.advance(1);
            assertEquals(opened + 1, transport.openCount(), "retry " + (retry + 1) + " did not fire");

            transport.last().drop(1006, "connection refused");
            scheduler.runPending();
        }

        assertTrue(supervisor.isFatal());
        assertEquals(ConnectionState.DISCONNECTED, supervisor.state());
        List<ConnectionEvent> fatal = connectionEvents(ConnectionEventType.FATAL_ERROR);
        assertEquals(1, fatal.size());
        assertEquals(ErrorKind.FATAL, fatal.get(0).errorKind());
        assertEquals(0, scheduler.pendingCount());

        scheduler.advance(60_000);
        assertEquals(4, transport.openCount());
    }

    @Test
    void testRestartAfterFatal() {
        create(BITGET_FUTURES, new BitgetProtocol(MarketType.FUTURES), new BackoffPolicy(100, 1.0, 100, 0));

        supervisor.start();
        scheduler.runPending();
        transport.last().drop(1006, "connection refused");
        scheduler.runPending();
        assertTrue(supervisor.isFatal());

        supervisor.start();
        scheduler.runPending();

        assertFalse(supervisor.isFatal());
        assertEquals(ConnectionState.CONNECTING, supervisor.state());
        assertEquals(2, transport.openCount());
    }

    @Test
    void testOpenTimeoutCountsAsFailure() {
        bitget();

        supervisor.start();
        scheduler.runPending();
        scheduler.advance(ReconnectSupervisor.OPEN_TIMEOUT_MS);

        assertEquals(ConnectionState.DISCONNECTED, supervisor.state());
        assertTrue(transport.last().closed);
        assertEquals(1, supervisor.retryAttempts());
        assertTrue(connectionEvents(ConnectionEventType.DISCONNECTED).get(0).message().contains("timed out"));
    }

    @Test
    void testStaleConnectionDetected() {
        bitget();
        FakeTransportAdapter.FakeHandle handle = startAndOpen();

        scheduler.advance(30_000);
        assertEquals(List.of("ping"), handle.sent);
        scheduler.advance(30_000);
        assertEquals(ConnectionState.STREAMING, supervisor.state());

        scheduler.advance(30_000);

        assertEquals(ConnectionState.CONNECTING, supervisor.state());
        assertTrue(handle.closed);
        ConnectionEvent disconnected = connectionEvents(ConnectionEventType.DISCONNECTED).get(0);
        assertTrue(disconnected.message().startsWith("stale"));
    }

    @Test
    void testTrafficKeepsConnectionAlive() {
        bitget();
        FakeTransportAdapter.FakeHandle handle = startAndOpen();

        for (int i = 0; i < 10; i++) {
            scheduler.advance(30_000);
            handle.receive("pong");
            scheduler.runPending();
        }

        assertEquals(ConnectionState.STREAMING, supervisor.state());
        assertEquals(10, handle.sent.size());
        assertTrue(connectionEvents(ConnectionEventType.DISCONNECTED).isEmpty());
    }

    @Test
    void testTokenRefreshedBeforeExpiry() {
        long tokenLifetime = 120_000;
        handshake = new FakeHandshakeProvider(true, scheduler::now, tokenLifetime);
        create(KUCOIN_FUTURES, new KucoinProtocol(MarketType.FUTURES), BackoffPolicy.defaults());
        subscriptions.add("XBTUSDTM", "ticker");

        FakeTransportAdapter.FakeHandle first = startAndOpen();
        assertEquals(ConnectionState.STREAMING, supervisor.state());
        assertEquals("token-1", first.auth.token());
        assertTrue(first.auth.socketUri().toString().contains("token=token-1&connectId=connect-1"));

        // keep the socket busy until the refresh point
        for (int i = 0; i < 3; i++) {
            scheduler.advance(15_000);
            first.receive("{\"id\":\"1\",\"type\":\"pong\",\"timestamp\":1732200000000000}");
            scheduler.runPending();
        }
        assertEquals(1, handshake.acquireCount);

        scheduler.advance(15_000);

        assertEquals(List.of(ConnectionState.AUTHENTICATING, ConnectionState.AUTHENTICATING), handshake.statesSeen);
        assertTrue(first.closed);
        assertEquals(2, transport.openCount());
        FakeTransportAdapter.FakeHandle second = transport.last();
        assertEquals("token-2", second.auth.token());
        assertEquals(ConnectionState.CONNECTING, supervisor.state());

        second.opened();
        scheduler.runPending();

        assertEquals(ConnectionState.STREAMING, supervisor.state());
        assertEquals(1, second.sent.size());
        assertTrue(second.sent.get(0).contains("\"topic\":\"/contractMarket/ticker:XBTUSDTM\""));
        assertEquals(0, supervisor.retryAttempts());
        ConnectionEvent refresh = connectionEvents(ConnectionEventType.DISCONNECTED).get(0);
        assertNull(refresh.errorKind());
    }

    @Test
    void testKucoinKeepaliveUsesAdvertisedInterval() {
        handshake = new FakeHandshakeProvider(true, scheduler::now, 86_400_000);
        handshake.pingIntervalMs = 10_000;
        create(KUCOIN_FUTURES, new KucoinProtocol(MarketType.FUTURES), BackoffPolicy.defaults());
        FakeTransportAdapter.FakeHandle handle = startAndOpen();
        assertEquals(0, supervisor.lastPingAt());

        scheduler.advance(10_000);
        assertEquals(List.of("{\"id\":\"1\",\"type\":\"ping\"}"), handle.sent);
        assertEquals(START + 10_000, supervisor.lastPingAt());

        handle.receive("{\"id\":\"1\",\"type\":\"pong\",\"timestamp\":1732200010000000}");
        scheduler.runPending();
        scheduler.advance(10_000);

        assertEquals(ConnectionState.STREAMING, supervisor.state());
        assertEquals("{\"id\":\"2\",\"type\":\"ping\"}", handle.sent.get(1));

        // no pong since 10 s: silent for exactly two intervals at 30 s, stale at 40 s
        scheduler.advance(10_000);
        assertEquals(ConnectionState.STREAMING, supervisor.state());
        assertEquals(3, handle.sent.size());

        scheduler.advance(10_000);
        assertEquals(ConnectionState.CONNECTING, supervisor.state());
        assertTrue(handle.closed);
        ConnectionEvent stale = connectionEvents(ConnectionEventType.DISCONNECTED).get(0);
        assertEquals(ErrorKind.TRANSPORT, stale.errorKind());
        assertTrue(stale.message().startsWith("stale"));
    }

    @Test
    void testStopDuringHandshakeReportsNoFailure() {
        handshake = new FakeHandshakeProvider(true, scheduler::now, 86_400_000);
        create(KUCOIN_FUTURES, new KucoinProtocol(MarketType.FUTURES), BackoffPolicy.defaults());
        // stop arrives while the token request is in flight and aborts it
        handshake.failuresRemaining = 1;
        handshake.onAcquire = () -> supervisor.stop();

        supervisor.start();
        scheduler.runPending();

        assertEquals(ConnectionState.DISCONNECTED, supervisor.state());
        assertTrue(connectionEvents(ConnectionEventType.DISCONNECTED).isEmpty());
        assertEquals(0, supervisor.errorCount());
        assertEquals(0, supervisor.retryAttempts());
        assertEquals(0, scheduler.pendingCount());

        handshake.onAcquire = () -> { };
        supervisor.start();
        scheduler.runPending();
        assertEquals(1, transport.openCount());
    }

    @Test
    void testHandshakeFailureRetried() {
        handshake = new FakeHandshakeProvider(true, scheduler::now, 86_400_000);
        handshake.failuresRemaining = 1;
        create(KUCOIN_FUTURES, new KucoinProtocol(MarketType.FUTURES), BackoffPolicy.defaults());

        supervisor.start();
        scheduler.runPending();

        assertEquals(ConnectionState.DISCONNECTED, supervisor.state());
        assertEquals(0, transport.openCount());
        assertEquals(ErrorKind.AUTH, connectionEvents(ConnectionEventType.DISCONNECTED).get(0).errorKind());

        scheduler.advance(BackoffPolicy.DEFAULT_BASE_DELAY_MS);

        assertEquals(2, handshake.acquireCount);
        assertEquals(1, transport.openCount());
        assertEquals(ConnectionState.CONNECTING, supervisor.state());
    }

    @Test
    void testMalformedMessageKeepsStreaming() {
        bitget();
        FakeTransportAdapter.FakeHandle handle = startAndOpen();

        handle.receive("{not json");
        handle.receive(BITGET_TICKER);
        scheduler.runPending();

        assertEquals(ConnectionState.STREAMING, supervisor.state());
        List<Control> errors = events.stream()
            .filter(event -> event instanceof Control)
            .map(event -> (Control) event)
            .collect(Collectors.toList());
        assertEquals(1, errors.size());
        assertEquals(ControlKind.PROTOCOL_ERROR, errors.get(0).kind());
        assertEquals("{not json", errors.get(0).rawPayload());

        Ticker ticker = (Ticker) events.get(events.size() - 1);
        assertEquals(new BigDecimal("88650"), ticker.lastPrice());
        assertEquals(1, supervisor.errorCount());
        assertEquals(2, supervisor.messageCount());
    }

    @Test
    void testNackDropsSubscription() {
        bitget();
        subscriptions.add("BADUSDT", "ticker");
        FakeTransportAdapter.FakeHandle handle = startAndOpen();

        handle.receive("""
            {"event":"error","arg":{"instType":"USDT-FUTURES","channel":"ticker","instId":"BADUSDT"},
             "code":30001,"msg":"instType:USDT-FUTURES,channel:ticker,instId:BADUSDT doesn't exist"}
            """);
        scheduler.runPending();

        assertEquals(ConnectionState.STREAMING, supervisor.state());
        assertTrue(subscriptions.desiredSet().isEmpty());
        ConnectionEvent failed = connectionEvents(ConnectionEventType.SUBSCRIPTION_FAILED).get(0);
        assertEquals(new SubscriptionKey("BADUSDT", "ticker"), failed.subscription());
        assertEquals(ErrorKind.SUBSCRIPTION, failed.errorKind());
    }

    @Test
    void testCallbacksFromOldSocketIgnored() {
        bitget();
        FakeTransportAdapter.FakeHandle first = startAndOpen();
        first.drop(1006, "connection reset");
        scheduler.runPending();
        scheduler.advance(BackoffPolicy.DEFAULT_BASE_DELAY_MS);
        transport.last().opened();
        scheduler.runPending();
        events.clear();

        first.receive(BITGET_TICKER);
        first.drop(1000, "late close");
        scheduler.runPending();

        assertTrue(events.isEmpty());
        assertEquals(ConnectionState.STREAMING, supervisor.state());
    }

    @Test
    void testStopClosesAndStaysDown() {
        bitget();
        FakeTransportAdapter.FakeHandle handle = startAndOpen();

        supervisor.stop();
        scheduler.runPending();

        assertEquals(ConnectionState.DISCONNECTED, supervisor.state());
        assertTrue(handle.closed);
        assertFalse(subscriptions.isConnected());
        assertEquals("stopped", connectionEvents(ConnectionEventType.DISCONNECTED).get(0).message());

        scheduler.advance(120_000);
        assertEquals(1, transport.openCount());

        supervisor.start();
        scheduler.runPending();
        assertEquals(2, transport.openCount());
    }

    @Test
    void testRetryCounterResetOnceStable() {
        bitget();
        FakeTransportAdapter.FakeHandle first = startAndOpen();
        first.drop(1006, "connection reset");
        scheduler.runPending();
        assertEquals(1, supervisor.retryAttempts());

        scheduler.advance(BackoffPolicy.DEFAULT_BASE_DELAY_MS);
        FakeTransportAdapter.FakeHandle second = transport.last();
        second.opened();
        scheduler.runPending();

        // exactly one keepalive cycle is not yet stable
        scheduler.advance(30_000);
        assertEquals(1, supervisor.retryAttempts());

        scheduler.advance(30_000);
        assertEquals(ConnectionState.STREAMING, supervisor.state());
        assertEquals(0, supervisor.retryAttempts());
    }

    @Test
    void testCloseReleasesTransport() {
        bitget();
        FakeTransportAdapter.FakeHandle handle = startAndOpen();

        supervisor.close();

        assertEquals(ConnectionState.DISCONNECTED, supervisor.state());
        assertTrue(handle.closed);
        assertTrue(transport.closed);
    }
}

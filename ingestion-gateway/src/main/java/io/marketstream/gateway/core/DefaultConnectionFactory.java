package io.marketstream.gateway.core;

import io.marketstream.gateway.auth.Credentials;
import io.marketstream.gateway.auth.HandshakeProvider;
import io.marketstream.gateway.auth.KucoinTokenProvider;
import io.marketstream.gateway.auth.StaticEndpointProvider;
import io.marketstream.gateway.exchange.ExchangeProtocol;
import io.marketstream.gateway.exchange.bitget.BitgetProtocol;
import io.marketstream.gateway.exchange.kucoin.KucoinProtocol;
import io.marketstream.gateway.metrics.GatewayMetrics;
import io.marketstream.gateway.subscription.SubscriptionManager;
import io.marketstream.gateway.transport.NettyTransportAdapter;
import io.marketstream.normalizer.api.MessageNormalizer;
import io.marketstream.normalizer.model.StreamEvent;
import org.agrona.concurrent.EpochClock;

import java.util.function.Consumer;

/**
 * Wires live exchange connections over Netty.
 */
public class DefaultConnectionFactory implements ConnectionFactory {

    private final EpochClock clock;
    private final boolean enableCompression;

    public DefaultConnectionFactory(EpochClock clock, boolean enableCompression) {
        this.clock = clock;
        this.enableCompression = enableCompression;
    }

    @Override
    public ReconnectSupervisor create(
        ConnectionId id,
        Credentials credentials,
        Consumer<StreamEvent> publisher,
        BackoffPolicy policy,
        GatewayMetrics metrics
    ) {
        ExchangeProtocol protocol = switch (id.exchange()) {
            case BITGET -> new BitgetProtocol(id.marketType());
            case KUCOIN -> new KucoinProtocol(id.marketType());
        };
        // Bitget market data is public; credentials only matter for the KuCoin private bullet
        HandshakeProvider handshake = switch (id.exchange()) {
            case BITGET -> new StaticEndpointProvider(BitgetProtocol.PUBLIC_ENDPOINT);
            case KUCOIN -> new KucoinTokenProvider(id.marketType(), credentials, clock);
        };

        return new ReconnectSupervisor(
            id,
            protocol,
            handshake,
            new NettyTransportAdapter(id.name(), enableCompression),
            MessageNormalizer.forExchange(id.exchange()),
            new SubscriptionManager(id.name(), protocol),
            publisher,
            policy,
            new ExecutorTaskScheduler(id.name(), clock),
            metrics
        );
    }
}

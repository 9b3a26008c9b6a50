package io.marketstream.gateway.transport;

import io.marketstream.gateway.auth.ConnectionAuth;
import io.marketstream.gateway.netty.NettyEventLoopFactory;
import io.marketstream.gateway.netty.WebSocketClient;
import io.netty.channel.EventLoopGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * {@link TransportAdapter} backed by a Netty {@link WebSocketClient}.
 * Each adapter owns a single-threaded event loop shared by every socket it opens.
 */
public class NettyTransportAdapter implements TransportAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyTransportAdapter.class);

    private final String name;
    private final boolean enableCompression;
    private final EventLoopGroup eventLoopGroup;

    public NettyTransportAdapter(String name, boolean enableCompression) {
        this.name = name;
        this.enableCompression = enableCompression;
        this.eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, "ws-" + name.toLowerCase());
    }

    @Override
    public TransportHandle open(ConnectionAuth auth, TransportListener listener) {
        WebSocketClient client = new WebSocketClient(auth.socketUri(), name, eventLoopGroup, listener, enableCompression);
        client.connect();
        return client;
    }

    @Override
    public void close() {
        try {
            eventLoopGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("{}: interrupted while stopping event loop", name);
        }
    }
}

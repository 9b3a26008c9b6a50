package io.marketstream.gateway.netty;

import io.marketstream.gateway.transport.TransportHandle;
import io.marketstream.gateway.transport.TransportListener;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;

/**
 * Netty-based WebSocket client for one exchange streaming endpoint.
 * The event loop group is owned by the caller so reconnects reuse the same thread.
 * Connection failures are reported to the listener, never thrown.
 */
public class WebSocketClient implements TransportHandle {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClient.class);

    public static final int MAX_FRAME_PAYLOAD_LENGTH = 10 * 1024 * 1024;
    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final int HANDSHAKE_AGGREGATOR_BYTES = 65_536;

    private final URI uri;
    private final String name;
    private final EventLoopGroup eventLoopGroup;
    private final TransportListener listener;
    private final boolean enableCompression;

    private volatile Channel channel;
    private volatile boolean closed;

    /**
     * Creates a new WebSocket client.
     *
     * @param uri               The WebSocket URI, including any query string
     * @param name              Friendly name used in log lines (e.g. "BITGET-FUTURES")
     * @param eventLoopGroup    Event loop group to run the channel on
     * @param listener          Receiver of lifecycle and message callbacks
     * @param enableCompression Whether to negotiate permessage-deflate
     */
    public WebSocketClient(
        URI uri,
        String name,
        EventLoopGroup eventLoopGroup,
        TransportListener listener,
        boolean enableCompression
    ) {
        this.uri = uri;
        this.name = name;
        this.eventLoopGroup = eventLoopGroup;
        this.listener = listener;
        this.enableCompression = enableCompression;
    }

    /**
     * Starts connecting. Returns immediately; the outcome arrives through the listener.
     */
    public void connect() {
        final boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        final String host = uri.getHost();
        final int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);

        final SslContext sslContext;
        try {
            sslContext = secure ? SslContextBuilder.forClient().protocols("TLSv1.2", "TLSv1.3").build() : null;
        } catch (SSLException e) {
            LOGGER.error("{}: failed to build TLS context", name, e);
            listener.onError(e);
            listener.onClosed(WebSocketCloseStatus.ABNORMAL_CLOSURE.code(), "TLS setup failed");
            return;
        }

        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<>() {
                @Override
                protected void initChannel(Channel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    if (sslContext != null) {
                        pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                    }
                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(HANDSHAKE_AGGREGATOR_BYTES));
                    if (enableCompression) {
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                    }
                    pipeline.addLast(new WebSocketClientHandler(name, uri, MAX_FRAME_PAYLOAD_LENGTH, listener));
                }
            });

        LOGGER.info("{}: connecting to {}:{}{}", name, host, port, uri.getPath());
        ChannelFuture future = bootstrap.connect(host, port);
        channel = future.channel();
        future.addListener(f -> {
            if (!f.isSuccess()) {
                LOGGER.warn("{}: connect failed: {}", name, f.cause() != null ? f.cause().toString() : "unknown");
                listener.onError(f.cause());
                listener.onClosed(WebSocketCloseStatus.ABNORMAL_CLOSURE.code(), "connect failed");
            } else if (closed) {
                future.channel().close();
            }
        });
    }

    @Override
    public boolean send(String message) {
        Channel ch = channel;
        if (closed || ch == null || !ch.isActive()) {
            LOGGER.warn("{}: cannot send message, not connected", name);
            return false;
        }
        ch.writeAndFlush(new TextWebSocketFrame(message)).addListener(f -> {
            if (!f.isSuccess()) {
                LOGGER.warn("{}: write failed: {}", name, f.cause() != null ? f.cause().toString() : "unknown");
            }
        });
        return true;
    }

    @Override
    public boolean isOpen() {
        Channel ch = channel;
        return !closed && ch != null && ch.isActive();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE))
                .addListener(f -> ch.close());
        } else if (ch != null) {
            ch.close();
        }
        LOGGER.debug("{}: closed", name);
    }
}

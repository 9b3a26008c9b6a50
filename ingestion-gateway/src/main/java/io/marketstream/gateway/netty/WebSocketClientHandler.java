package io.marketstream.gateway.netty;

import io.marketstream.gateway.transport.TransportListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Netty handler for one WebSocket client connection.
 * Completes the handshake, answers protocol pings and reports text frames and
 * the close code to a {@link TransportListener}. The close notification is delivered once.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final String name;
    private final WebSocketClientHandshaker handshaker;
    private final TransportListener listener;

    private int closeCode = WebSocketCloseStatus.ABNORMAL_CLOSURE.code();
    private String closeReason = "connection lost";
    private boolean closeReported;

    public WebSocketClientHandler(String name, URI uri, int maxFramePayloadLength, TransportListener listener) {
        this.name = name;
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            maxFramePayloadLength
        );
        this.listener = listener;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("{}: channel inactive", name);
        reportClosed();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("{}: WebSocket handshake complete", name);
                listener.onOpen();
            } catch (Exception e) {
                LOGGER.warn("{}: WebSocket handshake failed: {}", name, e.getMessage());
                closeReason = "handshake failed: " + e.getMessage();
                listener.onError(e);
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof TextWebSocketFrame textFrame) {
            listener.onMessage(textFrame.text());
            return;
        }

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            return;
        }

        if (frame instanceof CloseWebSocketFrame close) {
            closeCode = close.statusCode();
            closeReason = close.reasonText();
            LOGGER.debug("{}: received close frame code={} reason={}", name, closeCode, closeReason);
            ctx.close();
            return;
        }

        LOGGER.warn("{}: unsupported frame type: {}", name, frame.getClass().getName());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("{}: WebSocket exception: {}", name, cause.toString());
        closeReason = cause.toString();
        listener.onError(cause);
        ctx.close();
    }

    private void reportClosed() {
        if (closeReported) {
            return;
        }
        closeReported = true;
        listener.onClosed(closeCode, closeReason);
    }
}

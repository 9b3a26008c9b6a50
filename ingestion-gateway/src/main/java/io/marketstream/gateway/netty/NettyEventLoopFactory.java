package io.marketstream.gateway.netty;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for Netty event loop groups.
 * Uses epoll on Linux when the native transport is present, NIO elsewhere.
 */
public final class NettyEventLoopFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyEventLoopFactory.class);

    private static final boolean EPOLL_AVAILABLE = Epoll.isAvailable();

    static {
        LOGGER.info("Netty: using {} transport", EPOLL_AVAILABLE ? "native epoll" : "NIO");
    }

    private NettyEventLoopFactory() {
    }

    /**
     * Creates an event loop group whose threads are named after the connection.
     *
     * @param threads  Number of threads
     * @param poolName Thread name prefix
     */
    public static EventLoopGroup createEventLoopGroup(int threads, String poolName) {
        DefaultThreadFactory threadFactory = new DefaultThreadFactory(poolName, true);
        if (EPOLL_AVAILABLE) {
            return new EpollEventLoopGroup(threads, threadFactory);
        }
        return new NioEventLoopGroup(threads, threadFactory);
    }

    /**
     * Gets the SocketChannel class matching {@link #createEventLoopGroup}.
     */
    public static Class<? extends SocketChannel> getClientChannelClass() {
        return EPOLL_AVAILABLE ? EpollSocketChannel.class : NioSocketChannel.class;
    }

    public static boolean isEpollAvailable() {
        return EPOLL_AVAILABLE;
    }
}

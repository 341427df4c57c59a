package com.questrail.hlrbridge.transport.tcp.netty;

import com.questrail.hlrbridge.config.BridgeRuntimeConfig;
import com.questrail.hlrbridge.transport.StreamTransportListener;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * NettyTcpServerEndpoint
 * =============================================================================
 * Netty-backed TCP server hosting one {@link StreamTransportListener} per
 * accepted connection.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Reassemble IPA frames</li>
 *   <li>Interpret protocol semantics</li>
 *   <li>Retry writes or keep connections alive on its own</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the listening socket and returns once bound.
 * - {@link #stop()} closes the server channel and shuts down both event loop
 *   groups; open connections are closed with them.
 */
public final class NettyTcpServerEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpServerEndpoint.class);

    private final BridgeRuntimeConfig config;
    private final Supplier<? extends StreamTransportListener> listenerFactory;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    /**
     * @param listenerFactory called once per accepted connection, on that
     *                        connection's event loop
     */
    public NettyTcpServerEndpoint(BridgeRuntimeConfig config,
                                  Supplier<? extends StreamTransportListener> listenerFactory)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.listenerFactory = Objects.requireNonNull(listenerFactory, "listenerFactory");
    }

    public synchronized void start()
    {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(config.workerThreads());

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, config.backlog())
                .childOption(ChannelOption.TCP_NODELAY, config.tcpNoDelay())
                .childOption(ChannelOption.SO_KEEPALIVE, config.keepAlive())
                .handler(new LoggingHandler(NettyTcpServerEndpoint.class, LogLevel.DEBUG))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new NettyStreamHandler(listenerFactory.get(), null));
                    }
                });

        InetSocketAddress bindAddress = new InetSocketAddress(config.bindHost(), config.port());
        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            shutdownGroups();
            throw new IllegalStateException("Failed to bind " + bindAddress, f.cause());
        }

        serverChannel = f.channel();
        log.info("GSUP bridge listening on {}", serverChannel.localAddress());
    }

    public synchronized void stop()
    {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
            log.info("GSUP bridge stopped listening on {}", ch.localAddress());
        }
        shutdownGroups();
    }

    /**
     * Bound address, or {@code null} if not started. Useful when binding port 0.
     */
    public InetSocketAddress localAddress()
    {
        Channel ch = serverChannel;
        return ch == null ? null : (InetSocketAddress) ch.localAddress();
    }

    private void shutdownGroups()
    {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
    }
}

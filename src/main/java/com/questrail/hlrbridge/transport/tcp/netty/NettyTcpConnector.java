package com.questrail.hlrbridge.transport.tcp.netty;

import com.questrail.hlrbridge.transport.StreamConnector;
import com.questrail.hlrbridge.transport.StreamTransport;
import com.questrail.hlrbridge.transport.StreamTransportListener;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Netty-backed {@link StreamConnector} for outbound TCP connections.
 *
 * <p>One dedicated {@link NioEventLoopGroup} serves all connections opened by
 * this connector; {@link #shutdown()} releases it.</p>
 */
public final class NettyTcpConnector implements StreamConnector
{
    private final EventLoopGroup group = new NioEventLoopGroup(1);

    @Override
    public CompletableFuture<StreamTransport> connect(SocketAddress remote, StreamTransportListener listener)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(listener, "listener");

        CompletableFuture<StreamTransport> connected = new CompletableFuture<>();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new NettyStreamHandler(listener, connected));
                    }
                });

        bootstrap.connect(remote).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                connected.completeExceptionally(future.cause());
            }
        });
        return connected;
    }

    @Override
    public void shutdown()
    {
        group.shutdownGracefully();
    }
}

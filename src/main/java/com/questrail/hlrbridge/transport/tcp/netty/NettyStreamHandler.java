package com.questrail.hlrbridge.transport.tcp.netty;

import com.questrail.hlrbridge.transport.StreamTransport;
import com.questrail.hlrbridge.transport.StreamTransportListener;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * NettyStreamHandler
 * -----------------------------------------------------------------------------
 * Bridges one Netty channel to a {@link StreamTransportListener}.
 *
 * <p>Inbound {@link ByteBuf}s are copied into {@code byte[]} and released here;
 * no Netty type reaches the listener. All callbacks run on the channel's event
 * loop, which serializes them per connection.</p>
 *
 * <p>{@link StreamTransportListener#onClosed(Throwable)} is delivered at most
 * once even when an exception is followed by channel inactivity.</p>
 */
final class NettyStreamHandler extends ChannelInboundHandlerAdapter
{
    private final StreamTransportListener listener;
    private final CompletableFuture<StreamTransport> connected;

    private boolean closed;

    NettyStreamHandler(StreamTransportListener listener, CompletableFuture<StreamTransport> connected)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.connected = connected; // may be null on the server side
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception
    {
        StreamTransport transport = new NettyStreamTransport(ctx.channel());
        listener.onConnected(transport);
        if (connected != null) {
            connected.complete(transport);
        }
        super.channelActive(ctx);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg)
    {
        if (!(msg instanceof ByteBuf content)) {
            ReferenceCountUtil.release(msg);
            return;
        }

        byte[] bytes;
        try {
            bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
        }
        finally {
            content.release();
        }

        if (!closed) {
            listener.onData(bytes);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        notifyClosed(null);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        notifyClosed(cause);
        ctx.close();
    }

    private void notifyClosed(Throwable cause)
    {
        if (closed) {
            return;
        }
        closed = true;
        listener.onClosed(cause);
    }
}

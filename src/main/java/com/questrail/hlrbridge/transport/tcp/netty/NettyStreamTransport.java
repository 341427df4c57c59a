package com.questrail.hlrbridge.transport.tcp.netty;

import com.questrail.hlrbridge.transport.StreamTransport;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * {@link StreamTransport} over one Netty {@link Channel}.
 */
final class NettyStreamTransport implements StreamTransport
{
    private final Channel channel;

    NettyStreamTransport(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public void write(byte[] buf, int offset, int length)
    {
        Objects.checkFromIndexSize(offset, length, buf.length);
        // Copy so the caller may reuse buf once we return.
        channel.writeAndFlush(Unpooled.copiedBuffer(buf, offset, length));
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public String toString()
    {
        return "NettyStreamTransport[" + channel.remoteAddress() + ']';
    }
}

package com.questrail.bmux.transport.netty;

import com.questrail.bmux.api.Connection;
import com.questrail.bmux.codec.PacketEnvelope;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketAddress;

/**
 * {@link Connection} view of a Netty {@link Channel}.
 *
 * <p>Sends are asynchronous: the encoded envelope is queued on the channel
 * and the channel is closed if the write later fails. Write timeouts are
 * enforced by the pipeline's {@code WriteTimeoutHandler}.</p>
 */
final class ChannelConnection implements Connection
{
    private final String id;
    private final Channel channel;

    private volatile Object attachment;

    ChannelConnection(String id, Channel channel)
    {
        this.id = id;
        this.channel = channel;
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public SocketAddress localAddress()
    {
        return channel.localAddress();
    }

    @Override
    public void send(byte[] head, byte[] body)
    {
        PacketEnvelope envelope = new PacketEnvelope(head, body);

        if (!channel.isActive()) {
            throw new UncheckedIOException(new IOException("Connection " + id + " is closed"));
        }

        channel.writeAndFlush(Unpooled.wrappedBuffer(envelope.encode()))
                .addListener(ChannelFutureListener.CLOSE_ON_FAILURE);
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public Object attachment()
    {
        return attachment;
    }

    @Override
    public void attach(Object attachment)
    {
        this.attachment = attachment;
    }
}

package com.questrail.bmux.transport.netty;

import com.questrail.bmux.codec.PacketEnvelope;
import com.questrail.bmux.error.FramingException;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.concurrent.ScheduledFuture;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * EnvelopeFrameDecoder
 * =============================================================================
 * Reassembles {@link PacketEnvelope}s from a TCP byte stream.
 *
 * <p>Netty delivers whatever bytes the socket produced; this decoder keeps
 * partial frames in the cumulation buffer and emits an envelope once its
 * prefix, header and body are all present.</p>
 *
 * <h2>Read deadline</h2>
 * Each stage (prefix, header, body) must finish within the read timeout,
 * including the wait for the first prefix byte of the next frame. The timer
 * is armed when the channel becomes active, re-armed when the frame advances
 * to a new stage and restarted after every complete frame. On expiry the
 * pipeline receives a {@link FramingException}.
 *
 * <p>All state is confined to the channel's event loop.</p>
 */
final class EnvelopeFrameDecoder extends ByteToMessageDecoder
{
    private final long readTimeoutNanos;

    private Stage stage = Stage.NONE;
    private ScheduledFuture<?> stageTimer;

    EnvelopeFrameDecoder(Duration readTimeout)
    {
        this.readTimeoutNanos = readTimeout.toNanos();
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        int readable = in.readableBytes();
        if (readable < PacketEnvelope.PREFIX_LENGTH) {
            track(ctx, Stage.PREFIX);
            return;
        }

        int base = in.readerIndex();
        int headLength = in.getUnsignedByte(base);
        int bodyLength = in.getUnsignedShort(base + 1);

        if (readable < PacketEnvelope.PREFIX_LENGTH + headLength) {
            track(ctx, Stage.HEADER);
            return;
        }
        if (readable < PacketEnvelope.PREFIX_LENGTH + headLength + bodyLength) {
            track(ctx, Stage.BODY);
            return;
        }

        in.skipBytes(PacketEnvelope.PREFIX_LENGTH);
        byte[] head = new byte[headLength];
        in.readBytes(head);
        byte[] body = new byte[bodyLength];
        in.readBytes(body);

        restart(ctx, Stage.PREFIX);
        out.add(new PacketEnvelope(head, body));
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception
    {
        restart(ctx, Stage.PREFIX);
        super.channelActive(ctx);
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        // Complete frames were already drained; anything left is a partial frame.
        Stage pending = stage;
        restart(ctx, Stage.NONE);
        if (in.isReadable()) {
            int leftover = in.readableBytes();
            in.skipBytes(leftover);
            throw new FramingException(
                    "Stream closed while reading " + pending.label + " (" + leftover + " bytes buffered)");
        }
    }

    @Override
    protected void handlerRemoved0(ChannelHandlerContext ctx)
    {
        cancelTimer();
    }

    private void track(ChannelHandlerContext ctx, Stage next)
    {
        if (next != stage) {
            restart(ctx, next);
        }
    }

    private void restart(ChannelHandlerContext ctx, Stage next)
    {
        cancelTimer();
        stage = next;

        if (next != Stage.NONE && readTimeoutNanos > 0) {
            stageTimer = ctx.executor().schedule(
                    () -> expire(ctx, next),
                    readTimeoutNanos,
                    TimeUnit.NANOSECONDS);
        }
    }

    private void expire(ChannelHandlerContext ctx, Stage expired)
    {
        stageTimer = null;
        if (stage != expired || !ctx.channel().isActive()) {
            return;
        }
        ctx.fireExceptionCaught(new FramingException(
                "Read deadline exceeded while reading " + expired.label));
    }

    private void cancelTimer()
    {
        if (stageTimer != null) {
            stageTimer.cancel(false);
            stageTimer = null;
        }
    }

    private enum Stage
    {
        NONE("nothing"),
        PREFIX("length prefix"),
        HEADER("header"),
        BODY("body");

        private final String label;

        Stage(String label)
        {
            this.label = label;
        }
    }
}

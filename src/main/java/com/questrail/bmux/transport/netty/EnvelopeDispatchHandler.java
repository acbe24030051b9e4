package com.questrail.bmux.transport.netty;

import com.questrail.bmux.api.ConnectionLifetime;
import com.questrail.bmux.api.HandlerAction;
import com.questrail.bmux.codec.PacketEnvelope;
import com.questrail.bmux.observability.BmuxErrorEvent;
import com.questrail.bmux.transport.EnvelopeProcessor;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.IdleStateEvent;

/**
 * EnvelopeDispatchHandler
 * -----------------------------------------------------------------------------
 * Last stage of the connection pipeline: hands each complete envelope to the
 * shared {@link EnvelopeProcessor} on the channel's event loop, which keeps
 * per-connection processing strictly ordered.
 *
 * <p>Any failure, whether from the frame decoder, the header decoder or a
 * handler, is reported once and closes this channel only. Once a handler
 * returns {@link HandlerAction#CLOSE} or a failure is reported, envelopes
 * already decoded from the same read are dropped.</p>
 */
final class EnvelopeDispatchHandler<H> extends SimpleChannelInboundHandler<PacketEnvelope>
{
    private final EnvelopeProcessor<H> processor;
    private final ChannelConnection connection;
    private final ConnectionLifetime lifetime;

    private boolean closing;

    EnvelopeDispatchHandler(EnvelopeProcessor<H> processor,
                            ChannelConnection connection,
                            ConnectionLifetime lifetime)
    {
        super(PacketEnvelope.class);
        this.processor = processor;
        this.connection = connection;
        this.lifetime = lifetime;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, PacketEnvelope envelope)
    {
        if (closing || lifetime.isCancelled()) {
            return;
        }

        HandlerAction action = processor.process(envelope, connection, lifetime);
        if (action == HandlerAction.CLOSE) {
            closing = true;
            ctx.close();
        }
    }

    /**
     * Runs after the frame decoder has flushed a trailing partial frame, so
     * that failure is still reported before the lifetime is cancelled.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        try {
            lifetime.cancel();
        }
        catch (RuntimeException e) {
            processor.sink().onError(
                    BmuxErrorEvent.of(connection.id(), "Connection cancellation callback failed", e));
        }
        super.channelInactive(ctx);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
    {
        if (evt instanceof IdleStateEvent) {
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        Throwable failure = cause;
        if (failure instanceof DecoderException && failure.getCause() != null) {
            failure = failure.getCause();
        }

        if (!closing && !lifetime.isCancelled()) {
            processor.reportFailure(connection, failure);
        }
        closing = true;
        ctx.close();
    }
}

package com.questrail.bmux.transport;

import com.questrail.bmux.api.Connection;
import com.questrail.bmux.api.ConnectionLifetime;
import com.questrail.bmux.api.HandlerAction;
import com.questrail.bmux.api.MessageContext;
import com.questrail.bmux.codec.PacketEnvelope;
import com.questrail.bmux.error.FramingException;
import com.questrail.bmux.error.HeaderDecodeException;
import com.questrail.bmux.error.HeaderSchemaException;
import com.questrail.bmux.header.DecodedHeader;
import com.questrail.bmux.header.HeaderDecoder;
import com.questrail.bmux.observability.BmuxErrorEvent;
import com.questrail.bmux.observability.BmuxObservabilitySink;
import com.questrail.bmux.route.Dispatcher;

import java.util.Objects;

/**
 * EnvelopeProcessor
 * =============================================================================
 * The per-message path shared by both connection engines.
 *
 * <pre>
 *   PacketEnvelope
 *        → HeaderDecoder      (typed header + message id)
 *            → MessageContext
 *                → Dispatcher (composed handler chain)
 * </pre>
 *
 * <p>No partial-header dispatch: if the header fails to decode, nothing is
 * invoked and the exception propagates so the engine closes the
 * connection.</p>
 *
 * <p>Stateless apart from its collaborators; one instance serves all
 * connections.</p>
 */
public final class EnvelopeProcessor<H>
{
    private final HeaderDecoder<H> headerDecoder;
    private final Dispatcher<H> dispatcher;
    private final BmuxObservabilitySink sink;

    public EnvelopeProcessor(HeaderDecoder<H> headerDecoder, Dispatcher<H> dispatcher, BmuxObservabilitySink sink)
    {
        this.headerDecoder = Objects.requireNonNull(headerDecoder, "headerDecoder");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public BmuxObservabilitySink sink()
    {
        return sink;
    }

    /**
     * Decode and dispatch one envelope.
     *
     * @throws HeaderDecodeException  if the header does not match the schema
     * @throws HeaderSchemaException  if no message id can be resolved
     * @throws RuntimeException       whatever the handler chain throws
     */
    public HandlerAction process(PacketEnvelope envelope, Connection connection, ConnectionLifetime lifetime)
    {
        DecodedHeader<H> decoded = headerDecoder.decode(envelope.head());

        MessageContext<H> ctx = new MessageContext<>(
                lifetime,
                connection,
                decoded.header(),
                envelope.body(),
                decoded.messageId()
        );

        return dispatcher.dispatch(ctx);
    }

    /**
     * Report the failure that ended a connection.
     * A clean close between envelopes is not reported.
     */
    public void reportFailure(Connection connection, Throwable failure)
    {
        if (failure instanceof FramingException fe && fe.atBoundary()) {
            return;
        }
        sink.onError(BmuxErrorEvent.of(connection.id(), describe(failure), failure));
    }

    private static String describe(Throwable failure)
    {
        if (failure instanceof FramingException) {
            return "Framing failed";
        }
        if (failure instanceof HeaderDecodeException) {
            return "Header decode failed";
        }
        if (failure instanceof HeaderSchemaException) {
            return "Header has no resolvable message id";
        }
        return "Connection failed";
    }
}

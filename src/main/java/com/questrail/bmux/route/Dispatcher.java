package com.questrail.bmux.route;

import com.questrail.bmux.api.HandlerAction;
import com.questrail.bmux.api.MessageContext;
import com.questrail.bmux.api.MessageHandler;
import com.questrail.bmux.observability.BmuxObservabilitySink;
import com.questrail.bmux.observability.DispatchMissEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks up the composed handler for a message and invokes it synchronously.
 *
 * <p>A miss is not an error: it is reported to the sink and the connection
 * carries on with {@link HandlerAction#CONTINUE}. Exceptions thrown by a
 * handler propagate to the caller, which owns the connection.</p>
 */
public final class Dispatcher<H>
{
    private final DispatchTable<H> table;
    private final BmuxObservabilitySink sink;

    public Dispatcher(DispatchTable<H> table, BmuxObservabilitySink sink)
    {
        this.table = Objects.requireNonNull(table, "table");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public DispatchTable<H> table()
    {
        return table;
    }

    public HandlerAction dispatch(MessageContext<H> ctx)
    {
        Optional<MessageHandler<H>> handler = table.lookup(ctx.messageId());
        if (handler.isEmpty()) {
            sink.onDispatchMiss(new DispatchMissEvent(
                    Instant.now(),
                    ctx.connection().id(),
                    ctx.connection().remoteAddress(),
                    ctx.messageId()
            ));
            return HandlerAction.CONTINUE;
        }

        HandlerAction action = handler.get().handle(ctx);
        return action == null ? HandlerAction.CONTINUE : action;
    }
}

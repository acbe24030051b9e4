package com.questrail.bmux.route;

import com.questrail.bmux.api.MessageHandler;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from message id to a fully composed handler.
 *
 * <p>Produced once by {@link RouteCompiler} and only read afterwards, so
 * concurrent lookups need no synchronization.</p>
 */
public final class DispatchTable<H>
{
    private final Map<Integer, MessageHandler<H>> handlers;

    DispatchTable(Map<Integer, MessageHandler<H>> handlers)
    {
        this.handlers = Map.copyOf(handlers);
    }

    public static <H> DispatchTable<H> empty()
    {
        return new DispatchTable<>(Map.of());
    }

    public Optional<MessageHandler<H>> lookup(int messageId)
    {
        return Optional.ofNullable(handlers.get(messageId));
    }

    public boolean contains(int messageId)
    {
        return handlers.containsKey(messageId);
    }

    public Set<Integer> messageIds()
    {
        return handlers.keySet();
    }

    public int size()
    {
        return handlers.size();
    }
}

package com.questrail.bmux.api;

/**
 * Handles one dispatched message.
 *
 * <p>Handlers run synchronously on the connection's worker (blocking engine)
 * or on its event loop (event-loop engine). Messages of one connection are
 * never handled concurrently. On the event-loop engine a handler must not
 * block; long-running work belongs on another executor.</p>
 *
 * <p>A handler that throws is reported to the observability sink and its
 * connection is closed.</p>
 */
@FunctionalInterface
public interface MessageHandler<H>
{
    HandlerAction handle(MessageContext<H> ctx);
}

package com.questrail.bmux.middleware;

import com.questrail.bmux.api.HandlerAction;
import com.questrail.bmux.route.Middleware;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global middleware that logs every dispatched message at DEBUG.
 *
 * <p>Installed ahead of all user middleware when packet logging is enabled
 * in the server configuration. Logs the message id, the body size, the peer
 * and the action the rest of the chain returned.</p>
 */
public final class PacketLoggingMiddleware
{
    public static final String NAME = "packet_logging";

    private static final Logger log = LoggerFactory.getLogger("com.questrail.bmux.packets");

    private PacketLoggingMiddleware() {}

    public static <H> Middleware<H> create()
    {
        return Middleware.of(NAME, next -> ctx -> {
            if (!log.isDebugEnabled()) {
                return next.handle(ctx);
            }

            log.debug("<- {} msgid={} body={}B remote={}",
                    ctx.connection().id(),
                    ctx.messageId(),
                    ctx.body().length,
                    ctx.connection().remoteAddress());

            HandlerAction action = next.handle(ctx);

            log.debug("-- {} msgid={} action={}", ctx.connection().id(), ctx.messageId(), action);
            return action;
        });
    }
}

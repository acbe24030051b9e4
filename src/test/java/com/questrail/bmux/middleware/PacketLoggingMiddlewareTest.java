package com.questrail.bmux.middleware;

import com.questrail.bmux.api.HandlerAction;
import com.questrail.bmux.api.MessageContext;
import com.questrail.bmux.api.MessageHandler;
import com.questrail.bmux.api.StubConnection;
import com.questrail.bmux.route.Middleware;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class PacketLoggingMiddlewareTest
{
    @Test
    void passesContextThroughAndReturnsDownstreamAction()
    {
        AtomicReference<MessageContext<String>> seen = new AtomicReference<>();
        MessageHandler<String> downstream = ctx -> {
            seen.set(ctx);
            return HandlerAction.CLOSE;
        };

        Middleware<String> mw = PacketLoggingMiddleware.create();
        MessageContext<String> ctx = StubConnection.context(12, "hdr", new byte[] { 1, 2, 3 });

        HandlerAction action = mw.transform().wrap(downstream).handle(ctx);

        assertEquals(HandlerAction.CLOSE, action);
        assertSame(ctx, seen.get());
    }

    @Test
    void isEnabledAndNotExperimental()
    {
        Middleware<Object> mw = PacketLoggingMiddleware.create();

        assertEquals(PacketLoggingMiddleware.NAME, mw.name());
        assertTrue(mw.enabled());
        assertFalse(mw.experimental());
    }
}

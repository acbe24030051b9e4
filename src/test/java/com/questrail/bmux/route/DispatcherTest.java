package com.questrail.bmux.route;

import com.questrail.bmux.api.HandlerAction;
import com.questrail.bmux.api.StubConnection;
import com.questrail.bmux.observability.DispatchMissEvent;
import com.questrail.bmux.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DispatcherTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private DispatchTable<String> tableWith(int id, HandlerAction action)
    {
        Router<String> router = Router.<String>builder("r")
                .route(Route.<String>builder(id, "only", ctx -> action).build())
                .build();
        return new RouteCompiler<String>(false, sink).compile(List.of(router), List.of());
    }

    @Test
    void missIsReportedAndConnectionContinues()
    {
        Dispatcher<String> dispatcher = new Dispatcher<>(tableWith(1, HandlerAction.CLOSE), sink);

        HandlerAction action = dispatcher.dispatch(StubConnection.context(2, "h", new byte[0]));

        assertEquals(HandlerAction.CONTINUE, action);
        DispatchMissEvent miss = sink.eventsOfType(DispatchMissEvent.class).get(0);
        assertEquals(2, miss.messageId());
        assertEquals("conn-test", miss.connectionId());
    }

    @Test
    void hitReturnsHandlerAction()
    {
        Dispatcher<String> dispatcher = new Dispatcher<>(tableWith(1, HandlerAction.CLOSE), sink);

        assertEquals(HandlerAction.CLOSE, dispatcher.dispatch(StubConnection.context(1, "h", new byte[0])));
        assertFalse(sink.hasEventOfType(DispatchMissEvent.class));
    }

    @Test
    void nullActionCountsAsContinue()
    {
        Dispatcher<String> dispatcher = new Dispatcher<>(tableWith(1, null), sink);

        assertEquals(HandlerAction.CONTINUE, dispatcher.dispatch(StubConnection.context(1, "h", new byte[0])));
    }

    @Test
    void handlerExceptionPropagates()
    {
        Router<String> router = Router.<String>builder("r")
                .route(Route.<String>builder(1, "boom", ctx -> {
                    throw new IllegalStateException("boom");
                }).build())
                .build();
        DispatchTable<String> table = new RouteCompiler<String>(false, sink).compile(List.of(router), List.of());

        assertThrows(IllegalStateException.class,
                () -> new Dispatcher<>(table, sink).dispatch(StubConnection.context(1, "h", new byte[0])));
    }
}

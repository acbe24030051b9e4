package com.questrail.bmux.api;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionLifetimeTest
{
    @Test
    void cancelRunsCallbacksOnceInRegistrationOrder()
    {
        ConnectionLifetime lifetime = new ConnectionLifetime();
        List<String> ran = new ArrayList<>();
        lifetime.onCancel(() -> ran.add("a"));
        lifetime.onCancel(() -> ran.add("b"));

        assertTrue(lifetime.cancel());
        assertFalse(lifetime.cancel());

        assertTrue(lifetime.isCancelled());
        assertEquals(List.of("a", "b"), ran);
    }

    @Test
    void callbackAddedAfterCancelRunsImmediately()
    {
        ConnectionLifetime lifetime = new ConnectionLifetime();
        lifetime.cancel();

        List<String> ran = new ArrayList<>();
        lifetime.onCancel(() -> ran.add("late"));

        assertEquals(List.of("late"), ran);
    }

    @Test
    void failingCallbackDoesNotStopTheOthers()
    {
        ConnectionLifetime lifetime = new ConnectionLifetime();
        List<String> ran = new ArrayList<>();
        lifetime.onCancel(() -> { throw new IllegalStateException("first"); });
        lifetime.onCancel(() -> ran.add("second"));
        lifetime.onCancel(() -> { throw new IllegalArgumentException("third"); });

        IllegalStateException e = assertThrows(IllegalStateException.class, lifetime::cancel);

        assertEquals(List.of("second"), ran);
        assertEquals(1, e.getSuppressed().length);
        assertTrue(lifetime.isCancelled());
    }
}

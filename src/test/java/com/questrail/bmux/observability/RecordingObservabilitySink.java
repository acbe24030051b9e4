package com.questrail.bmux.observability;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements BmuxObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onLifecycleEvent(ServerLifecycleEvent event) {
        record(event);
    }

    @Override
    public synchronized void onConnectionEvent(ConnectionEvent event) {
        record(event);
    }

    @Override
    public synchronized void onRouteRegistered(RouteRegistrationEvent event) {
        record(event);
    }

    @Override
    public synchronized void onDispatchMiss(DispatchMissEvent event) {
        record(event);
    }

    @Override
    public synchronized void onError(BmuxErrorEvent event) {
        record(event);
    }

    private void record(Object event) {
        events.add(event);
        notifyAll();
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    /**
     * Block until an event of the given type matching {@code match} has been
     * recorded, or fail with an {@link AssertionError} after {@code timeout}.
     */
    public synchronized <T> T await(Class<T> type, Predicate<T> match, Duration timeout)
        throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            for (Object e : events) {
                if (type.isInstance(e) && match.test(type.cast(e))) {
                    return type.cast(e);
                }
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new AssertionError("No matching " + type.getSimpleName() + " within " + timeout
                    + "; recorded: " + events);
            }
            wait(Math.max(1, remaining / 1_000_000));
        }
    }
}

package com.questrail.bmux.observability;

/**
 * Main interface for receiving bmux server observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from acceptor threads, connection workers and event
 * loops concurrently; implementations must be thread-safe and must not
 * block.</p>
 */
public interface BmuxObservabilitySink {
    /**
     * Called when the server binds, starts shutting down, stops, or fails to
     * drain in time.
     * @param event the lifecycle event
     */
    void onLifecycleEvent(ServerLifecycleEvent event);

    /**
     * Called when a connection is opened, closed, or rejected at the cap.
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called once per route that enters the dispatch table.
     * @param event the registration details
     */
    void onRouteRegistered(RouteRegistrationEvent event);

    /**
     * Called when a well-formed message has no registered handler.
     * The connection stays open.
     * @param event the miss details
     */
    void onDispatchMiss(DispatchMissEvent event);

    /**
     * Called when an error terminates a connection or disturbs the server.
     * @param event the error event
     */
    void onError(BmuxErrorEvent event);
}

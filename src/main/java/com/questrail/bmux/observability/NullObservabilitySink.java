package com.questrail.bmux.observability;

/**
 * No-op implementation of BmuxObservabilitySink.
 */
public final class NullObservabilitySink implements BmuxObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLifecycleEvent(ServerLifecycleEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onRouteRegistered(RouteRegistrationEvent event) {}

    @Override
    public void onDispatchMiss(DispatchMissEvent event) {}

    @Override
    public void onError(BmuxErrorEvent event) {}
}

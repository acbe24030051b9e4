package com.questrail.bmux.observability;

import com.questrail.bmux.error.FramingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BmuxObservabilitySink that emits logs via SLF4J.
 *
 * <p>Framing failures are logged at WARN without a stack trace: a peer
 * hanging up mid-frame is routine. Everything else reported through
 * {@link #onError} is logged at ERROR with its cause.</p>
 */
public final class Slf4jBmuxObservabilitySink implements BmuxObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger("com.questrail.bmux");

    @Override
    public void onLifecycleEvent(ServerLifecycleEvent event) {
        switch (event.phase()) {
            case BOUND -> log.info("bmux listening on {}", event.address());
            case SHUTTING_DOWN -> log.warn("bmux shutting down ({})", event.detail());
            case STOPPED -> log.info("bmux stopped");
            case DRAIN_TIMEOUT -> log.error("bmux shutdown did not drain: {}", event.detail());
        }
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        if (event.kind() == ConnectionEvent.Kind.REJECTED) {
            log.warn("Connection from {} rejected: {} active", event.remote(), event.activeConnections());
            return;
        }
        log.debug("Connection {} {} remote={} active={}",
            event.connectionId(),
            event.kind(),
            event.remote(),
            event.activeConnections());
    }

    @Override
    public void onRouteRegistered(RouteRegistrationEvent event) {
        if (event.replaced()) {
            log.warn("Route '{}' (id {}) in router '{}' replaces an earlier route with the same id",
                event.routeName(), event.routeId(), event.routerName());
        }
        log.debug("Registering route name={} id={} router={} experimental={}",
            event.routeName(), event.routeId(), event.routerName(), event.experimental());
    }

    @Override
    public void onDispatchMiss(DispatchMissEvent event) {
        log.warn("No handler registered for message id {} (connection {}, remote {})",
            event.messageId(), event.connectionId(), event.remote());
    }

    @Override
    public void onError(BmuxErrorEvent event) {
        if (event.cause() instanceof FramingException) {
            log.warn("Connection {}: {}: {}", event.connectionId(), event.message(), event.cause().getMessage());
            return;
        }
        log.error("bmux error (connection {}): {}", event.connectionId(), event.message(), event.cause());
    }
}

package com.questrail.bmux.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a connection opening, closing, or being turned away.
 *
 * @param activeConnections number of registered connections after the change
 */
public record ConnectionEvent(
    Instant timestamp,
    Kind kind,
    String connectionId,
    SocketAddress remote,
    int activeConnections
) {
    public enum Kind {
        OPENED,
        CLOSED,
        REJECTED
    }

    public static ConnectionEvent of(Kind kind, String connectionId, SocketAddress remote, int activeConnections) {
        return new ConnectionEvent(Instant.now(), kind, connectionId, remote, activeConnections);
    }
}

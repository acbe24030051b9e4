package com.questrail.bmux.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a server lifecycle transition.
 */
public record ServerLifecycleEvent(
    Instant timestamp,
    Phase phase,
    SocketAddress address,
    String detail
) {
    public enum Phase {
        BOUND,
        SHUTTING_DOWN,
        STOPPED,
        DRAIN_TIMEOUT
    }

    public static ServerLifecycleEvent of(Phase phase, SocketAddress address, String detail) {
        return new ServerLifecycleEvent(Instant.now(), phase, address, detail);
    }
}

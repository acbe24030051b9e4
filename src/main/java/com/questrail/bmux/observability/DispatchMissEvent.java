package com.questrail.bmux.observability;

import java.net.SocketAddress;
import java.time.Instant;

/**
 * Record representing a message whose id has no handler in the dispatch table.
 */
public record DispatchMissEvent(
    Instant timestamp,
    String connectionId,
    SocketAddress remote,
    int messageId
) {
}

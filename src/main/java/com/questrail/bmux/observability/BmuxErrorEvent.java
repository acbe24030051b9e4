package com.questrail.bmux.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the bmux server.
 *
 * @param connectionId the affected connection, or {@code null} for server-level errors
 */
public record BmuxErrorEvent(
    Instant timestamp,
    String connectionId,
    String message,
    Throwable cause
) {
    public static BmuxErrorEvent of(String connectionId, String message, Throwable cause) {
        return new BmuxErrorEvent(Instant.now(), connectionId, message, cause);
    }
}

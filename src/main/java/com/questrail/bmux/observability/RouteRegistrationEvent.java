package com.questrail.bmux.observability;

import java.time.Instant;

/**
 * Record describing a route that entered the dispatch table.
 *
 * @param replaced {@code true} if an earlier route with the same id was overwritten
 */
public record RouteRegistrationEvent(
    Instant timestamp,
    String routerName,
    String routeName,
    int routeId,
    boolean experimental,
    boolean replaced
) {
}

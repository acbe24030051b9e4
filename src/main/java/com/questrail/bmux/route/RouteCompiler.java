package com.questrail.bmux.route;

import com.questrail.bmux.api.MessageHandler;
import com.questrail.bmux.observability.BmuxObservabilitySink;
import com.questrail.bmux.observability.RouteRegistrationEvent;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * RouteCompiler
 * =============================================================================
 * Folds routers, routes and middleware into a {@link DispatchTable}.
 *
 * <h2>Selection</h2>
 * <ul>
 *   <li>Routers are visited in registration order; disabled routers are skipped.</li>
 *   <li>Within a router, disabled routes are skipped, and experimental routes
 *       are skipped unless experimental features are enabled.</li>
 * </ul>
 *
 * <h2>Composition</h2>
 * Each route's handler is wrapped from the inside out:
 * <pre>
 *   global( router( route( handler ) ) )
 * </pre>
 * Within a tier the first registered middleware ends up outermost, so on
 * dispatch the order is: global middleware in registration order, then router
 * middleware, then route middleware, then the handler. Inactive middleware
 * (disabled, or experimental while experimental features are off) is left
 * out of the chain entirely.
 *
 * <h2>Duplicate ids</h2>
 * A later route with an id already in the table replaces the earlier one.
 * The replacement is reported to the sink; it is not an error.
 *
 * <p>Composition happens once here; dispatch never re-wraps.</p>
 */
public final class RouteCompiler<H>
{
    private final boolean experimentalEnabled;
    private final BmuxObservabilitySink sink;

    public RouteCompiler(boolean experimentalEnabled, BmuxObservabilitySink sink)
    {
        this.experimentalEnabled = experimentalEnabled;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public DispatchTable<H> compile(List<Router<H>> routers, List<Middleware<H>> global)
    {
        Objects.requireNonNull(routers, "routers");
        Objects.requireNonNull(global, "global");

        Map<Integer, MessageHandler<H>> table = new HashMap<>();

        for (Router<H> router : routers) {
            if (!router.enabled()) {
                continue;
            }

            for (Route<H> route : router.routes()) {
                if (!route.enabled()) {
                    continue;
                }
                if (route.experimental() && !experimentalEnabled) {
                    continue;
                }

                MessageHandler<H> handler = route.handler();
                handler = wrap(handler, route.middleware());
                handler = wrap(handler, router.middleware());
                handler = wrap(handler, global);

                boolean replaced = table.put(route.id(), handler) != null;

                sink.onRouteRegistered(new RouteRegistrationEvent(
                        Instant.now(),
                        router.name(),
                        route.name(),
                        route.id(),
                        route.experimental(),
                        replaced
                ));
            }
        }

        return new DispatchTable<>(table);
    }

    private MessageHandler<H> wrap(MessageHandler<H> handler, List<Middleware<H>> tier)
    {
        // Wrap last-registered first so the first-registered runs outermost.
        for (int i = tier.size() - 1; i >= 0; i--) {
            Middleware<H> mw = tier.get(i);
            if (!mw.activeWhen(experimentalEnabled)) {
                continue;
            }
            handler = Objects.requireNonNull(mw.transform().wrap(handler),
                    () -> "Middleware '" + mw.name() + "' returned a null handler");
        }
        return handler;
    }
}

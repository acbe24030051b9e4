package com.questrail.bmux.route;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named group of routes sharing router-level middleware.
 *
 * <p>Disabling a router removes every one of its routes from the dispatch
 * table, whatever their own flags say.</p>
 */
public record Router<H>(
        String name,
        boolean enabled,
        List<Route<H>> routes,
        List<Middleware<H>> middleware
) {
    public Router {
        Objects.requireNonNull(name, "name");
        routes = List.copyOf(routes);
        middleware = List.copyOf(middleware);
    }

    public static <H> Builder<H> builder(String name) {
        return new Builder<>(name);
    }

    public static final class Builder<H> {
        private final String name;
        private boolean enabled = true;
        private final List<Route<H>> routes = new ArrayList<>();
        private final List<Middleware<H>> middleware = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<H> enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder<H> route(Route<H> route) {
            this.routes.add(Objects.requireNonNull(route, "route"));
            return this;
        }

        public Builder<H> middleware(Middleware<H> mw) {
            this.middleware.add(Objects.requireNonNull(mw, "middleware"));
            return this;
        }

        public Router<H> build() {
            return new Router<>(name, enabled, routes, middleware);
        }
    }
}

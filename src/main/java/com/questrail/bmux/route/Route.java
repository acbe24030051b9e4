package com.questrail.bmux.route;

import com.questrail.bmux.api.MessageHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps one message id to a handler and its route-level middleware.
 *
 * <p>Route middleware sits closest to the handler: it runs after global and
 * router middleware.</p>
 */
public record Route<H>(
        int id,
        String name,
        boolean enabled,
        boolean experimental,
        MessageHandler<H> handler,
        List<Middleware<H>> middleware
) {
    public Route {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
        middleware = List.copyOf(middleware);
    }

    public static <H> Builder<H> builder(int id, String name, MessageHandler<H> handler) {
        return new Builder<>(id, name, handler);
    }

    public static final class Builder<H> {
        private final int id;
        private final String name;
        private final MessageHandler<H> handler;
        private boolean enabled = true;
        private boolean experimental = false;
        private final List<Middleware<H>> middleware = new ArrayList<>();

        private Builder(int id, String name, MessageHandler<H> handler) {
            this.id = id;
            this.name = name;
            this.handler = handler;
        }

        public Builder<H> enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder<H> experimental(boolean experimental) {
            this.experimental = experimental;
            return this;
        }

        public Builder<H> middleware(Middleware<H> mw) {
            this.middleware.add(Objects.requireNonNull(mw, "middleware"));
            return this;
        }

        public Route<H> build() {
            return new Route<>(id, name, enabled, experimental, handler, middleware);
        }
    }
}

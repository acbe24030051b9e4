package com.questrail.bmux.route;

import com.questrail.bmux.api.HandlerTransform;

import java.util.Objects;

/**
 * A named handler transform that can be applied globally, per router, or per
 * route.
 *
 * <p>Disabled middleware is skipped at compile time. Experimental middleware
 * is skipped unless the server enables experimental features.</p>
 */
public record Middleware<H>(
        String name,
        boolean enabled,
        boolean experimental,
        HandlerTransform<H> transform
) {
    public Middleware {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(transform, "transform");
    }

    /**
     * Enabled, non-experimental middleware.
     */
    public static <H> Middleware<H> of(String name, HandlerTransform<H> transform) {
        return new Middleware<>(name, true, false, transform);
    }

    public Middleware<H> withEnabled(boolean enabled) {
        return new Middleware<>(name, enabled, experimental, transform);
    }

    public Middleware<H> withExperimental(boolean experimental) {
        return new Middleware<>(name, enabled, experimental, transform);
    }

    boolean activeWhen(boolean experimentalEnabled) {
        return enabled && (!experimental || experimentalEnabled);
    }
}

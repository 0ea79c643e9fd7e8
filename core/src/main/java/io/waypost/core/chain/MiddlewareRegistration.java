package io.waypost.core.chain;

import java.util.Objects;

/**
 * A middleware bound to a path prefix. It applies to every request whose
 * path starts with {@code prefix}; the empty prefix applies to all requests.
 *
 * @param prefix     path prefix, compared case-sensitively
 * @param middleware the middleware
 */
public record MiddlewareRegistration(String prefix, Middleware middleware) {

    public MiddlewareRegistration {
        Objects.requireNonNull(prefix, "prefix must not be null; use \"\" to match every path");
        Objects.requireNonNull(middleware, "middleware must not be null");
    }

    public boolean appliesTo(String path) {
        return path != null && path.startsWith(prefix);
    }
}

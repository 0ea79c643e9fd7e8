package io.waypost.core.routing;

import io.waypost.core.chain.Handler;
import io.waypost.core.model.HttpMethod;
import java.util.Objects;

/**
 * One route registration: method, path, and the terminal handler.
 *
 * @param method   the HTTP method
 * @param template the compiled path
 * @param handler  the handler invoked when the route wins dispatch
 */
public record Route(HttpMethod method, PathTemplate template, Handler handler) {

    public Route {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
    }

    /** The registered path string. */
    public String path() {
        return template.source();
    }

    @Override
    public String toString() {
        return "Route[" + method + " " + template + "]";
    }
}

package io.waypost.core.routing;

import io.waypost.core.chain.Handler;
import io.waypost.core.model.HttpMethod;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Append-only ordered list of route registrations.
 *
 * <p>
 * Dispatch scans the list in registration order and returns the first route
 * whose method equals the request method and whose {@link PathTemplate}
 * matches the path. Duplicate registrations are accepted; the earlier one
 * always wins.
 *
 * <p>
 * Not thread-safe while routes are being registered. {@link #snapshot()}
 * yields an immutable copy that is safe to share across request threads.
 */
public final class RouteRegistry {

    private final List<Route> routes;

    public RouteRegistry() {
        this.routes = new ArrayList<>();
    }

    private RouteRegistry(List<Route> frozen) {
        this.routes = frozen;
    }

    /**
     * Appends a route.
     *
     * @throws IllegalArgumentException if the path template is malformed
     * @throws UnsupportedOperationException on a snapshot
     */
    public Route register(HttpMethod method, String path, Handler handler) {
        Route route = new Route(method, PathTemplate.compile(path), handler);
        routes.add(route);
        return route;
    }

    /**
     * Resolves the handler for a request.
     *
     * @return the first matching route with its captures, or empty (not found)
     */
    public Optional<RouteMatch> dispatch(HttpMethod method, String path) {
        for (Route route : routes) {
            if (route.method() != method) {
                continue;
            }
            Optional<RouteMatch> match = route.template().match(path).map(params -> new RouteMatch(route, params));
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /** Registered routes in order. */
    public List<Route> routes() {
        return Collections.unmodifiableList(routes);
    }

    public int size() {
        return routes.size();
    }

    /** An immutable copy of the current registrations. */
    public RouteRegistry snapshot() {
        return new RouteRegistry(List.copyOf(routes));
    }
}

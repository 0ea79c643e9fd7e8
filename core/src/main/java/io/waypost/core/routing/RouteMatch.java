package io.waypost.core.routing;

import java.util.Map;

/**
 * Successful dispatch: the winning route and the values its template captured.
 *
 * @param route  the matched route
 * @param params captured path values, empty for literal routes
 */
public record RouteMatch(Route route, Map<String, String> params) {

    public RouteMatch {
        params = params != null ? Map.copyOf(params) : Map.of();
    }
}

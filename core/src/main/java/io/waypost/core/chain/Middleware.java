package io.waypost.core.chain;

import io.waypost.core.model.RequestContext;
import io.waypost.core.model.ResponseBuilder;

/**
 * A link in the request chain that runs before the terminal handler.
 *
 * <p>
 * Legal behaviors:
 * <ul>
 * <li>return a response without calling {@code next}, which short-circuits the
 * remaining middlewares and the handler;</li>
 * <li>call {@code next.run(request, response)} and return its result,
 * optionally post-processed (timing, logging, header decoration);</li>
 * <li>derive a new request or response and forward it to {@code next}.</li>
 * </ul>
 * {@code next} may be called at most once.
 */
@FunctionalInterface
public interface Middleware {

    /**
     * @param request  the request snapshot
     * @param response the response accumulated so far
     * @param next     single-use continuation to the rest of the chain
     * @return the response to send upstream; never null
     * @throws Exception any failure; the app answers it with a 500 problem
     */
    ResponseBuilder handle(RequestContext request, ResponseBuilder response, Next next) throws Exception;
}

package io.waypost.core.chain;

import io.waypost.core.model.RequestContext;
import io.waypost.core.model.ResponseBuilder;

/**
 * Terminal request handler. Runs after every matching middleware and does
 * not receive a {@link Next}.
 */
@FunctionalInterface
public interface Handler {

    /**
     * Produces the response for a request.
     *
     * @param request  the request snapshot
     * @param response the response accumulated by upstream middlewares
     * @return the response to send; never null
     * @throws Exception any failure; the app answers it with a 500 problem
     */
    ResponseBuilder handle(RequestContext request, ResponseBuilder response) throws Exception;
}

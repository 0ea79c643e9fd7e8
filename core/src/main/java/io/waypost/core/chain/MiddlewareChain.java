package io.waypost.core.chain;

import io.waypost.core.model.RequestContext;
import io.waypost.core.model.ResponseBuilder;
import java.util.List;
import java.util.Objects;

/**
 * The chain resolved for one request: an immutable middleware array plus a
 * terminal handler.
 *
 * <p>
 * {@link Next} carries only a cursor into this array, so invoking the next
 * link is an index increment rather than a nested closure. The chain itself
 * holds no per-request state; each {@link #execute} creates fresh
 * continuations.
 */
public final class MiddlewareChain {

    private final Middleware[] middlewares;
    private final Handler terminal;

    public MiddlewareChain(List<Middleware> middlewares, Handler terminal) {
        this.middlewares = middlewares.toArray(new Middleware[0]);
        this.terminal = Objects.requireNonNull(terminal, "terminal handler must not be null");
    }

    /**
     * Runs the chain from its first link.
     *
     * @throws Exception whatever a middleware or the handler throws
     */
    public ResponseBuilder execute(RequestContext request, ResponseBuilder response) throws Exception {
        return new Next(this, 0).run(request, response);
    }

    ResponseBuilder invokeAt(int cursor, RequestContext request, ResponseBuilder response) throws Exception {
        if (cursor == middlewares.length) {
            return Objects.requireNonNull(
                    terminal.handle(request, response), "terminal handler returned a null response");
        }
        ResponseBuilder result = middlewares[cursor].handle(request, response, new Next(this, cursor + 1));
        return Objects.requireNonNull(result, () -> "middleware at chain position " + cursor + " returned null");
    }

    /** Number of middlewares ahead of the terminal handler. */
    public int length() {
        return middlewares.length;
    }
}

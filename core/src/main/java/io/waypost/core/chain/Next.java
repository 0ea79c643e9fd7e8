package io.waypost.core.chain;

import io.waypost.core.model.RequestContext;
import io.waypost.core.model.ResponseBuilder;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-use continuation: "the remainder of the chain plus the terminal
 * handler", bound to a cursor into an immutable {@link MiddlewareChain}.
 */
public final class Next {

    private final MiddlewareChain chain;
    private final int cursor;
    private final AtomicBoolean used = new AtomicBoolean();

    Next(MiddlewareChain chain, int cursor) {
        this.chain = chain;
        this.cursor = cursor;
    }

    /**
     * Runs the rest of the chain and returns its response.
     *
     * @throws IllegalStateException if this continuation was already run
     * @throws Exception             whatever a downstream link throws
     */
    public ResponseBuilder run(RequestContext request, ResponseBuilder response) throws Exception {
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("next.run() called more than once at chain position " + cursor);
        }
        return chain.invokeAt(cursor, request, response);
    }
}

package io.waypost.core.error;

import io.waypost.core.model.ProblemDetail;

/**
 * Abstract parent for failures raised while building a request context from
 * transport primitives. The request is answered with {@link #status()} before
 * any middleware or handler runs, so user code never observes a
 * half-constructed context.
 */
public abstract class RequestRejectedException extends WaypostException {

    private static final long serialVersionUID = 1L;

    private final int status;

    protected RequestRejectedException(String message, int status) {
        super(message);
        this.status = status;
    }

    protected RequestRejectedException(String message, Throwable cause, int status) {
        super(message, cause);
        this.status = status;
    }

    /** HTTP status the rejection is answered with. */
    public int status() {
        return status;
    }

    /**
     * Renders this rejection as an RFC 9457 problem.
     *
     * @param instancePath the request path, may be null
     */
    public abstract ProblemDetail toProblem(String instancePath);
}

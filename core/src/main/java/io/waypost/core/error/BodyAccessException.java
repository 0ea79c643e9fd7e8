package io.waypost.core.error;

/**
 * Abstract parent for failures of the typed body accessors on
 * {@link io.waypost.core.model.RequestContext}. These are recoverable: they
 * reach the calling handler or middleware, which decides how to answer.
 */
public abstract class BodyAccessException extends WaypostException {

    private static final long serialVersionUID = 1L;

    protected BodyAccessException(String message) {
        super(message);
    }

    protected BodyAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}

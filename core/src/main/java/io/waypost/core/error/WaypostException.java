package io.waypost.core.error;

/**
 * Abstract base for all waypost exceptions. Never thrown directly; use the
 * concrete subclasses under {@link RequestRejectedException},
 * {@link BodyAccessException}, or the standalone {@link MissingHeaderException}
 * and {@link TransportBindException}.
 */
public abstract class WaypostException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected WaypostException(String message) {
        super(message);
    }

    protected WaypostException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}

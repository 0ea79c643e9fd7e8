package io.waypost.core.error;

import io.waypost.core.model.ProblemDetail;

/** The request body stream went past the configured byte limit. */
public final class BodyTooLargeException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    private final long limit;

    public BodyTooLargeException(long limit) {
        super("Request body exceeds " + limit + " bytes", 413);
        this.limit = limit;
    }

    /** The byte limit that was exceeded. */
    public long limit() {
        return limit;
    }

    @Override
    public ProblemDetail toProblem(String instancePath) {
        return ProblemDetail.payloadTooLarge(getMessage(), instancePath);
    }
}

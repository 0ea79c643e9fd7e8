package io.waypost.core.error;

import io.waypost.core.model.ProblemDetail;

/** A body declared as {@code application/json} does not parse as one JSON document. */
public final class InvalidJsonException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public InvalidJsonException(String reason) {
        super("Invalid JSON: " + reason, 400);
    }

    public InvalidJsonException(String reason, Throwable cause) {
        super("Invalid JSON: " + reason, cause, 400);
    }

    @Override
    public ProblemDetail toProblem(String instancePath) {
        return ProblemDetail.badRequest(getMessage(), instancePath);
    }
}

package io.waypost.core.error;

import io.waypost.core.model.ProblemDetail;

/** The request body bytes are not valid UTF-8. */
public final class InvalidUtf8Exception extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public InvalidUtf8Exception(Throwable cause) {
        super("Invalid UTF-8 sequence", cause, 400);
    }

    @Override
    public ProblemDetail toProblem(String instancePath) {
        return ProblemDetail.badRequest(getMessage(), instancePath);
    }
}

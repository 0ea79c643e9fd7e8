package io.waypost.core.error;

import io.waypost.core.model.ProblemDetail;
import java.io.IOException;

/** The transport failed while the request body was being read. */
public final class BodyReadException extends RequestRejectedException {

    private static final long serialVersionUID = 1L;

    public BodyReadException(IOException cause) {
        super("Failed to read request body: " + cause.getMessage(), cause, 400);
    }

    @Override
    public ProblemDetail toProblem(String instancePath) {
        return ProblemDetail.badRequest(getMessage(), instancePath);
    }
}

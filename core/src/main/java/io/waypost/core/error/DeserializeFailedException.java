package io.waypost.core.error;

/** The JSON body parsed, but does not fit the requested target type. */
public final class DeserializeFailedException extends BodyAccessException {

    private static final long serialVersionUID = 1L;

    public DeserializeFailedException(String reason, Throwable cause) {
        super("Failed to deserialize JSON: " + reason, cause);
    }
}

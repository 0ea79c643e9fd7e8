package io.waypost.core.error;

import io.waypost.core.model.BodyType;

/** A body accessor was called against a request of a different classification. */
public final class WrongBodyTypeException extends BodyAccessException {

    private static final long serialVersionUID = 1L;

    private final BodyType expected;
    private final BodyType actual;

    public WrongBodyTypeException(BodyType expected, BodyType actual) {
        super("Wrong body type: expected " + expected + " but request body is " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public BodyType expected() {
        return expected;
    }

    public BodyType actual() {
        return actual;
    }
}

package io.waypost.core.error;

/** A response header that a caller required has not been set. */
public final class MissingHeaderException extends WaypostException {

    private static final long serialVersionUID = 1L;

    private final String headerName;

    public MissingHeaderException(String headerName) {
        super("Missing header: " + headerName);
        this.headerName = headerName;
    }

    public String headerName() {
        return headerName;
    }
}

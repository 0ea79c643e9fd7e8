package io.waypost.core.model;

/** Content type implied by the last body setter invoked on a {@link ResponseBuilder}. */
public enum ResponseContentType {
    JSON("application/json"),
    TEXT("text/plain"),
    PROBLEM_JSON("application/problem+json");

    private final String value;

    ResponseContentType(String value) {
        this.value = value;
    }

    /** Returns the MIME type written to the {@code Content-Type} header. */
    public String value() {
        return value;
    }
}

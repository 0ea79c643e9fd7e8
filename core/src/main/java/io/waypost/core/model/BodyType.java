package io.waypost.core.model;

/**
 * Classification of a request body, derived from the {@code content-type}
 * header when the request context is built.
 */
public enum BodyType {
    /** {@code application/json} anywhere in the content type. */
    JSON,

    /** Anything that is neither JSON nor form data, including an absent header. */
    TEXT,

    /** {@code application/x-www-form-urlencoded} anywhere in the content type. */
    FORM;

    static final String JSON_MARKER = "application/json";
    static final String FORM_MARKER = "application/x-www-form-urlencoded";

    /**
     * Classifies a {@code content-type} header value. The search is a
     * case-sensitive substring match; JSON is checked before form data.
     *
     * @param contentType the header value, may be null
     * @return the classification, {@link #TEXT} when nothing matches
     */
    public static BodyType fromContentType(String contentType) {
        if (contentType == null) {
            return TEXT;
        }
        if (contentType.contains(JSON_MARKER)) {
            return JSON;
        }
        if (contentType.contains(FORM_MARKER)) {
            return FORM;
        }
        return TEXT;
    }
}

package io.waypost.core.model;

import java.util.Optional;

/** HTTP methods that routes can be registered for. */
public enum HttpMethod {
    GET,
    PUT,
    POST,
    DELETE,
    PATCH;

    /**
     * Resolves a transport method name. Matching is exact (upper case), as
     * method tokens are case-sensitive per RFC 9110 §9.1.
     *
     * @param method the method token as received, may be null
     * @return the method, or empty for anything outside this enumeration
     */
    public static Optional<HttpMethod> parse(String method) {
        if (method == null) {
            return Optional.empty();
        }
        for (HttpMethod candidate : values()) {
            if (candidate.name().equals(method)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}

package io.waypost.core.middleware;

/**
 * Selects the fields {@link RequestLogger} writes for each request.
 *
 * @param method   log the request method
 * @param path     log the request path
 * @param duration log the elapsed time in milliseconds
 */
public record RequestLoggerConfig(boolean method, boolean path, boolean duration) {

    /** All fields enabled. */
    public static final RequestLoggerConfig DEFAULT = new RequestLoggerConfig(true, true, true);

    /** True if at least one field is enabled. */
    public boolean anyEnabled() {
        return method || path || duration;
    }
}

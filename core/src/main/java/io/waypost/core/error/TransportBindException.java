package io.waypost.core.error;

/**
 * The transport server could not bind its listening address. This is the only
 * process-fatal failure; it aborts startup.
 */
public final class TransportBindException extends WaypostException {

    private static final long serialVersionUID = 1L;

    private final String address;

    public TransportBindException(String address, Throwable cause) {
        super("Failed to bind " + address + ": " + (cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.address = address;
    }

    /** The {@code host:port} that could not be bound. */
    public String address() {
        return address;
    }
}

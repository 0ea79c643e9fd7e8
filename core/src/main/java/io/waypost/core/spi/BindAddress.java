package io.waypost.core.spi;

/**
 * A {@code host:port} listening address. Port {@code 0} asks the transport
 * for an ephemeral port.
 *
 * @param host interface to bind, e.g. {@code 0.0.0.0}
 * @param port TCP port, 0–65535
 */
public record BindAddress(String host, int port) {

    public BindAddress {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * Parses {@code host:port}. The last colon separates the port, so a
     * bracketed IPv6 literal such as {@code [::1]:8080} is accepted.
     *
     * @throws IllegalArgumentException if the string is not {@code host:port}
     */
    public static BindAddress parse(String address) {
        if (address == null) {
            throw new IllegalArgumentException("address must not be null");
        }
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Expected host:port but got '" + address + "'");
        }
        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in '" + address + "'", e);
        }
        return new BindAddress(host, port);
    }

    @Override
    public String toString() {
        return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + port;
    }
}

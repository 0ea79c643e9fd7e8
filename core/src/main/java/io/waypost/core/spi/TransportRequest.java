package io.waypost.core.spi;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Transport-side view of one inbound request: the primitives a transport
 * server hands to the core. Each transport (Javalin, a test fake, etc.)
 * provides an implementation wrapping its native request object.
 *
 * <p>
 * Implementations report data exactly as received: no header-name
 * normalization, no percent-decoding. The core builds its own
 * {@link io.waypost.core.model.RequestContext} from these values.
 */
public interface TransportRequest {

    /** The method token, e.g. {@code POST}. */
    String method();

    /** The request path without query string. */
    String path();

    /** The raw query string without leading {@code ?}; null or empty if absent. */
    String queryString();

    /** Header pairs in arrival order; a multi-valued header yields one pair per value. */
    List<Map.Entry<String, String>> headers();

    /** Cookie pairs in arrival order. Duplicate names are allowed. */
    List<Map.Entry<String, String>> cookies();

    /** Path captures resolved by the transport's own routing; empty if none. */
    Map<String, String> pathParams();

    /**
     * The request body stream. Consumed once by the core.
     *
     * @throws IOException if the transport cannot provide the stream
     */
    InputStream body() throws IOException;

    /** The peer's IP address, or null if the transport cannot tell. */
    String peerAddress();
}

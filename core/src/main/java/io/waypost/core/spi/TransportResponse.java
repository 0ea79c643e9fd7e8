package io.waypost.core.spi;

import java.util.Map;
import java.util.Set;

/**
 * Finalized response handed back to the transport for writing.
 *
 * @param status         HTTP status code
 * @param contentType    value for the {@code Content-Type} header
 * @param body           response body bytes
 * @param headers        additional headers
 * @param cookies        cookies to set
 * @param clearedCookies cookie names to expire on the client
 */
public record TransportResponse(
        int status,
        String contentType,
        byte[] body,
        Map<String, String> headers,
        Map<String, String> cookies,
        Set<String> clearedCookies) {

    public TransportResponse {
        body = body != null ? body : new byte[0];
        headers = headers != null ? Map.copyOf(headers) : Map.of();
        cookies = cookies != null ? Map.copyOf(cookies) : Map.of();
        clearedCookies = clearedCookies != null ? Set.copyOf(clearedCookies) : Set.of();
    }

    @Override
    public String toString() {
        return "TransportResponse[" + status + ", " + contentType + ", " + body.length + " bytes]";
    }
}

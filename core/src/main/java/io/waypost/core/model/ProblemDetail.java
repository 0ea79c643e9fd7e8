package io.waypost.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * RFC 9457 Problem Details body for responses the framework produces itself
 * (rejected request bodies, unmatched routes, handler failures).
 *
 * <pre>{@code
 * {
 * "type": "urn:waypost:request:body-too-large",
 * "title": "Payload Too Large",
 * "status": 413,
 * "detail": "Request body exceeds 262144 bytes",
 * "instance": "/api/upload"
 * }
 * }</pre>
 *
 * @param type     URN identifying the error category
 * @param title    short human-readable title
 * @param status   HTTP status code
 * @param detail   human-readable description
 * @param instance request path, may be null
 */
public record ProblemDetail(String type, String title, int status, String detail, String instance) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_BAD_REQUEST = "urn:waypost:request:bad-request";
    static final String URN_BODY_TOO_LARGE = "urn:waypost:request:body-too-large";
    static final String URN_NOT_FOUND = "urn:waypost:route:not-found";
    static final String URN_INTERNAL_ERROR = "urn:waypost:handler:internal-error";

    /** Malformed request body (invalid UTF-8, invalid JSON, unreadable stream). */
    public static ProblemDetail badRequest(String detail, String instancePath) {
        return new ProblemDetail(URN_BAD_REQUEST, "Bad Request", 400, detail, instancePath);
    }

    /** Request body over the size limit. */
    public static ProblemDetail payloadTooLarge(String detail, String instancePath) {
        return new ProblemDetail(URN_BODY_TOO_LARGE, "Payload Too Large", 413, detail, instancePath);
    }

    /** No route matched the request method and path. */
    public static ProblemDetail notFound(String detail, String instancePath) {
        return new ProblemDetail(URN_NOT_FOUND, "Not Found", 404, detail, instancePath);
    }

    /** A middleware or handler failed with an unexpected exception. */
    public static ProblemDetail internalError(String detail, String instancePath) {
        return new ProblemDetail(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    /** Renders this problem as a JSON object. */
    public ObjectNode toJson() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instance != null) {
            node.put("instance", instance);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}

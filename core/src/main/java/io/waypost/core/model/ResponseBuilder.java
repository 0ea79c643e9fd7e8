package io.waypost.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.waypost.core.error.MissingHeaderException;
import io.waypost.core.spi.TransportResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Value-semantics accumulator for an outgoing response.
 *
 * <p>
 * Every mutator returns a <strong>new</strong> builder and leaves the receiver
 * untouched, so the instance threaded through a chain is always the most
 * recently produced value. {@link #json(Object)} and {@link #text(String)}
 * both replace the body; whichever runs last decides the content type.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class ResponseBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final byte[] EMPTY = new byte[0];
    private static final ResponseBuilder INITIAL = new ResponseBuilder(
            200,
            EMPTY,
            ResponseContentType.TEXT,
            new TreeMap<>(String.CASE_INSENSITIVE_ORDER),
            new LinkedHashMap<>(),
            new LinkedHashSet<>());

    private final int statusCode;
    private final byte[] body;
    private final ResponseContentType contentType;
    private final Map<String, String> headers;
    private final Map<String, String> cookies;
    private final Set<String> clearedCookies;

    private ResponseBuilder(
            int statusCode,
            byte[] body,
            ResponseContentType contentType,
            Map<String, String> headers,
            Map<String, String> cookies,
            Set<String> clearedCookies) {
        this.statusCode = statusCode;
        this.body = body;
        this.contentType = contentType;
        this.headers = headers;
        this.cookies = cookies;
        this.clearedCookies = clearedCookies;
    }

    /** Returns a fresh builder: status 200, empty text body, no headers. */
    public static ResponseBuilder create() {
        return INITIAL;
    }

    // ── Status ──

    public ResponseBuilder status(int code) {
        return new ResponseBuilder(code, body, contentType, headers, cookies, clearedCookies);
    }

    public ResponseBuilder ok() {
        return status(200);
    }

    public ResponseBuilder badRequest() {
        return status(400);
    }

    public ResponseBuilder notFound() {
        return status(404);
    }

    public ResponseBuilder internalServerError() {
        return status(500);
    }

    /** Status 302 with a {@code Location} header. */
    public ResponseBuilder redirect(String location) {
        return status(302).header("Location", location);
    }

    // ── Body ──

    /**
     * Serializes {@code value} with Jackson and marks the response as JSON.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    public ResponseBuilder json(Object value) {
        byte[] bytes;
        try {
            bytes = MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize response body as JSON", e);
        }
        return new ResponseBuilder(statusCode, bytes, ResponseContentType.JSON, headers, cookies, clearedCookies);
    }

    /** Sets a UTF-8 text body and marks the response as plain text. */
    public ResponseBuilder text(String value) {
        byte[] bytes = value != null ? value.getBytes(StandardCharsets.UTF_8) : EMPTY;
        return new ResponseBuilder(statusCode, bytes, ResponseContentType.TEXT, headers, cookies, clearedCookies);
    }

    /** Replaces status and body with an RFC 9457 problem. */
    public ResponseBuilder problem(ProblemDetail problem) {
        byte[] bytes = problem.toJson().toString().getBytes(StandardCharsets.UTF_8);
        return new ResponseBuilder(
                problem.status(), bytes, ResponseContentType.PROBLEM_JSON, headers, cookies, clearedCookies);
    }

    // ── Headers and cookies ──

    public ResponseBuilder header(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, () -> "value of header " + name);
        Map<String, String> next = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        next.putAll(headers);
        next.put(name, value);
        return new ResponseBuilder(statusCode, body, contentType, next, cookies, clearedCookies);
    }

    /**
     * Header previously set on this response (case-insensitive).
     *
     * @throws MissingHeaderException if the header was never set
     */
    public String getHeader(String name) {
        String value = headers.get(name);
        if (value == null) {
            throw new MissingHeaderException(name);
        }
        return value;
    }

    public ResponseBuilder cookie(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, () -> "value of cookie " + name);
        Map<String, String> nextCookies = new LinkedHashMap<>(cookies);
        nextCookies.put(name, value);
        Set<String> nextCleared = new LinkedHashSet<>(clearedCookies);
        nextCleared.remove(name);
        return new ResponseBuilder(statusCode, body, contentType, headers, nextCookies, nextCleared);
    }

    /** Instructs the client to drop a cookie (expired {@code Set-Cookie}). */
    public ResponseBuilder clearCookie(String name) {
        Map<String, String> nextCookies = new LinkedHashMap<>(cookies);
        nextCookies.remove(name);
        Set<String> nextCleared = new LinkedHashSet<>(clearedCookies);
        nextCleared.add(name);
        return new ResponseBuilder(statusCode, body, contentType, headers, nextCookies, nextCleared);
    }

    // ── Accessors ──

    public int statusCode() {
        return statusCode;
    }

    /** A copy of the body bytes. */
    public byte[] body() {
        return body.clone();
    }

    /** The body decoded as UTF-8. */
    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public ResponseContentType contentType() {
        return contentType;
    }

    public Map<String, String> headers() {
        return Collections.unmodifiableMap(headers);
    }

    public Map<String, String> cookies() {
        return Collections.unmodifiableMap(cookies);
    }

    public Set<String> clearedCookies() {
        return Collections.unmodifiableSet(clearedCookies);
    }

    /** Finalizes into the transport's response shape. No further validation. */
    public TransportResponse toTransport() {
        return new TransportResponse(
                statusCode, contentType.value(), body.clone(), headers(), cookies(), clearedCookies());
    }

    // ── equals / hashCode (byte-content-aware) ──

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponseBuilder that)) return false;
        return statusCode == that.statusCode
                && contentType == that.contentType
                && Arrays.equals(body, that.body)
                && headers.equals(that.headers)
                && cookies.equals(that.cookies)
                && clearedCookies.equals(that.clearedCookies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statusCode, contentType, Arrays.hashCode(body), headers, cookies, clearedCookies);
    }

    @Override
    public String toString() {
        return "ResponseBuilder[" + statusCode + ", " + contentType + ", " + body.length + " bytes]";
    }
}

package io.waypost.core.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.waypost.core.error.DeserializeFailedException;
import io.waypost.core.error.WrongBodyTypeException;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable snapshot of one inbound HTTP request.
 *
 * <p>
 * Production code obtains instances from
 * {@link io.waypost.core.app.RequestContextFactory}, which builds them exactly
 * once per request from transport primitives. {@link #builder()} and
 * {@link #toBuilder()} exist for test fixtures and for middlewares that
 * forward a derived request to {@code next}; the original instance is never
 * changed.
 *
 * <p>
 * Header names are kept as received; lookups through {@link #getHeader} are
 * case-insensitive (RFC 9110 §5.1). Query values are stored without
 * percent-decoding.
 *
 * <p>
 * Thread-safe: all state is final and collections are unmodifiable.
 */
public final class RequestContext {

    private static final ObjectMapper MAPPER =
            new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Map<String, String> params;
    private final Map<String, String> queries;
    private final Map<String, String> headers;
    private final Map<String, String> cookies;
    private final BodyContent body;
    private final String method;
    private final String path;
    private final String originUrl;
    private final String ip;

    private RequestContext(Builder builder) {
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.queries = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queries));
        TreeMap<String, String> headerStore = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headerStore.putAll(builder.headers);
        this.headers = Collections.unmodifiableMap(headerStore);
        this.cookies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.cookies));
        this.body = builder.body;
        this.method = builder.method;
        this.path = builder.path;
        this.originUrl = builder.originUrl != null ? builder.originUrl : builder.path;
        this.ip = builder.ip;
    }

    // ── Scalar fields ──

    /** The method token exactly as the transport reported it. */
    public String method() {
        return method;
    }

    /** The request path, without query string. */
    public String path() {
        return path;
    }

    /** Path plus {@code ?} and the raw query string, when one was sent. */
    public String originUrl() {
        return originUrl;
    }

    /**
     * Client address: first {@code X-Forwarded-For} entry, else the transport
     * peer address, else {@code "unknown"}.
     */
    public String ip() {
        return ip;
    }

    // ── Keyed lookups ──

    /** Route capture by name, e.g. {@code id} for {@code /users/{id}}. */
    public Optional<String> getParam(String name) {
        return Optional.ofNullable(params.get(name));
    }

    /** Query parameter by name; the raw, undecoded value. */
    public Optional<String> getQuery(String name) {
        return Optional.ofNullable(queries.get(name));
    }

    /** Header by name (case-insensitive). */
    public Optional<String> getHeader(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    /** Cookie by name. */
    public Optional<String> getCookie(String name) {
        return Optional.ofNullable(cookies.get(name));
    }

    public Map<String, String> params() {
        return params;
    }

    public Map<String, String> queries() {
        return queries;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public Map<String, String> cookies() {
        return cookies;
    }

    // ── Body ──

    /** True if the body was classified as {@code bodyType}. */
    public boolean is(BodyType bodyType) {
        return body.type() == bodyType;
    }

    public BodyType bodyType() {
        return body.type();
    }

    public BodyContent body() {
        return body;
    }

    /**
     * Deserializes the JSON body into {@code type}.
     *
     * @throws WrongBodyTypeException      if the body is not JSON
     * @throws DeserializeFailedException  if the document does not fit {@code type}
     */
    public <T> T json(Class<T> type) {
        JsonNode node = requireJson();
        try {
            return MAPPER.readerFor(type).readValue(node);
        } catch (IOException | IllegalArgumentException e) {
            throw new DeserializeFailedException(e.getMessage(), e);
        }
    }

    /**
     * Deserializes the JSON body into a generic target such as
     * {@code List<Order>}.
     *
     * @throws WrongBodyTypeException      if the body is not JSON
     * @throws DeserializeFailedException  if the document does not fit the type
     */
    public <T> T json(TypeReference<T> type) {
        JsonNode node = requireJson();
        try {
            return MAPPER.readerFor(type).readValue(node);
        } catch (IOException | IllegalArgumentException e) {
            throw new DeserializeFailedException(e.getMessage(), e);
        }
    }

    /** A copy of the JSON body tree. */
    public JsonNode jsonNode() {
        return requireJson().deepCopy();
    }

    /**
     * The text body.
     *
     * @throws WrongBodyTypeException if the body is not plain text
     */
    public String text() {
        if (body instanceof BodyContent.Text text) {
            return text.value();
        }
        throw new WrongBodyTypeException(BodyType.TEXT, body.type());
    }

    /**
     * Splits the form body on {@code &}, then each pair on its first {@code =}.
     * Pairs without {@code =} are dropped; a repeated key keeps its last value.
     * Values are not percent-decoded.
     *
     * @throws WrongBodyTypeException if the body is not form data
     */
    public Map<String, String> formData() {
        if (!(body instanceof BodyContent.Form form)) {
            throw new WrongBodyTypeException(BodyType.FORM, body.type());
        }
        return Collections.unmodifiableMap(splitPairs(form.raw()));
    }

    private JsonNode requireJson() {
        if (body instanceof BodyContent.Json json) {
            return json.value();
        }
        throw new WrongBodyTypeException(BodyType.JSON, body.type());
    }

    /**
     * Splits {@code a=1&b=2} into an ordered map. Shared by query-string and
     * form-body parsing.
     */
    public static Map<String, String> splitPairs(String raw) {
        Map<String, String> pairs = new LinkedHashMap<>();
        if (raw == null || raw.isEmpty()) {
            return pairs;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            if (eq >= 0) {
                pairs.put(pair.substring(0, eq), pair.substring(eq + 1));
            }
        }
        return pairs;
    }

    // ── Builders ──

    /** Returns a builder with an empty text body, method {@code GET} and path {@code /}. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this request's state. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.params.putAll(params);
        builder.queries.putAll(queries);
        builder.headers.putAll(headers);
        builder.cookies.putAll(cookies);
        builder.body = body;
        builder.method = method;
        builder.path = path;
        builder.originUrl = originUrl;
        builder.ip = ip;
        return builder;
    }

    @Override
    public String toString() {
        return "RequestContext[" + method + " " + originUrl + ", body=" + body.type() + "]";
    }

    /** Accumulates request state; later writes to the same key win. */
    public static final class Builder {

        private final Map<String, String> params = new LinkedHashMap<>();
        private final Map<String, String> queries = new LinkedHashMap<>();
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, String> cookies = new LinkedHashMap<>();
        private BodyContent body = BodyContent.emptyText();
        private String method = "GET";
        private String path = "/";
        private String originUrl;
        private String ip = "unknown";

        Builder() {}

        public Builder method(String method) {
            this.method = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder path(String path) {
            this.path = Objects.requireNonNull(path, "path");
            return this;
        }

        /** Sets the origin URL; defaults to the path when never set. */
        public Builder originUrl(String originUrl) {
            this.originUrl = originUrl;
            return this;
        }

        public Builder ip(String ip) {
            this.ip = Objects.requireNonNull(ip, "ip");
            return this;
        }

        public Builder param(String name, String value) {
            params.put(name, value);
            return this;
        }

        public Builder params(Map<String, String> values) {
            params.putAll(values);
            return this;
        }

        public Builder query(String name, String value) {
            queries.put(name, value);
            return this;
        }

        public Builder queries(Map<String, String> values) {
            queries.putAll(values);
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder cookie(String name, String value) {
            cookies.put(name, value);
            return this;
        }

        public Builder body(BodyContent body) {
            this.body = Objects.requireNonNull(body, "body");
            return this;
        }

        /** Sets a JSON body from any value Jackson can serialize. */
        public Builder json(Object value) {
            this.body = new BodyContent.Json(MAPPER.valueToTree(value));
            return this;
        }

        public Builder text(String text) {
            this.body = new BodyContent.Text(text);
            return this;
        }

        /**
         * Appends {@code key=value} to the form body, switching the body to
         * form data first if it held anything else.
         */
        public Builder form(String key, String value) {
            String pair = key + "=" + value;
            if (body instanceof BodyContent.Form existing) {
                this.body = new BodyContent.Form(existing.raw() + "&" + pair);
            } else {
                this.body = new BodyContent.Form(pair);
            }
            return this;
        }

        public RequestContext build() {
            return new RequestContext(this);
        }
    }
}

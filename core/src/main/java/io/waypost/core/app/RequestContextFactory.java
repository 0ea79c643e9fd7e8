package io.waypost.core.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.waypost.core.error.BodyReadException;
import io.waypost.core.error.BodyTooLargeException;
import io.waypost.core.error.InvalidJsonException;
import io.waypost.core.error.InvalidUtf8Exception;
import io.waypost.core.model.BodyContent;
import io.waypost.core.model.BodyType;
import io.waypost.core.model.RequestContext;
import io.waypost.core.spi.TransportRequest;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link RequestContext} from transport primitives.
 *
 * <p>
 * Steps, in order: copy method, path and origin URL; split the query string
 * (no percent-decoding, last duplicate wins); copy cookies and headers as
 * received; resolve the client IP; classify the body by {@code content-type};
 * read the body with a hard byte cap; decode and parse it per classification.
 *
 * <p>
 * Any failure surfaces as a
 * {@link io.waypost.core.error.RequestRejectedException} before the chain
 * runs.
 *
 * <p>
 * Thread-safe: all state is local to each {@link #create} invocation.
 */
public final class RequestContextFactory {

    private static final Logger LOG = LoggerFactory.getLogger(RequestContextFactory.class);

    /** Hard cap on request body bytes. */
    public static final int MAX_BODY_BYTES = 262_144;

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String CONTENT_TYPE = "content-type";
    static final String UNKNOWN_IP = "unknown";

    private static final int CHUNK_SIZE = 8192;
    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final int maxBodyBytes;

    public RequestContextFactory() {
        this(MAX_BODY_BYTES);
    }

    RequestContextFactory(int maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }

    /**
     * Builds the context for one request.
     *
     * @param request     the transport request; its body stream is consumed
     * @param routeParams captures from route dispatch, overriding transport captures
     * @return the immutable request snapshot
     * @throws BodyTooLargeException if the body exceeds the byte cap
     * @throws InvalidUtf8Exception  if the body is not valid UTF-8
     * @throws InvalidJsonException  if a JSON-classified body does not parse
     * @throws BodyReadException     if the body stream fails
     */
    public RequestContext create(TransportRequest request, Map<String, String> routeParams) {
        String path = request.path();
        String query = request.queryString();

        RequestContext.Builder builder = RequestContext.builder()
                .method(request.method())
                .path(path)
                .originUrl(query == null || query.isEmpty() ? path : path + "?" + query)
                .queries(RequestContext.splitPairs(query))
                .params(request.pathParams())
                .params(routeParams);

        for (Map.Entry<String, String> cookie : request.cookies()) {
            builder.cookie(cookie.getKey(), cookie.getValue());
        }

        String forwardedFor = null;
        String contentType = null;
        for (Map.Entry<String, String> header : request.headers()) {
            builder.header(header.getKey(), header.getValue());
            // First occurrence wins for the two headers read during construction
            if (forwardedFor == null && FORWARDED_FOR.equalsIgnoreCase(header.getKey())) {
                forwardedFor = header.getValue();
            } else if (contentType == null && CONTENT_TYPE.equalsIgnoreCase(header.getKey())) {
                contentType = header.getValue();
            }
        }

        builder.ip(resolveIp(forwardedFor, request.peerAddress()));

        BodyType bodyType = BodyType.fromContentType(contentType);
        byte[] bytes = readBody(request);
        builder.body(parseBody(bodyType, bytes));

        RequestContext context = builder.build();
        LOG.debug(
                "request context built: {} {} (body={} bytes, type={}, headers={})",
                context.method(),
                context.originUrl(),
                bytes.length,
                bodyType,
                context.headers().size());
        return context;
    }

    /**
     * First comma-separated {@code X-Forwarded-For} entry, trimmed; else the
     * peer address; else {@code "unknown"}.
     */
    static String resolveIp(String forwardedFor, String peerAddress) {
        if (forwardedFor != null) {
            int comma = forwardedFor.indexOf(',');
            return (comma >= 0 ? forwardedFor.substring(0, comma) : forwardedFor).trim();
        }
        if (peerAddress != null) {
            return peerAddress;
        }
        return UNKNOWN_IP;
    }

    private byte[] readBody(TransportRequest request) {
        ByteArrayOutputStream accumulated = new ByteArrayOutputStream();
        byte[] chunk = new byte[CHUNK_SIZE];
        try (InputStream in = request.body()) {
            if (in == null) {
                return new byte[0];
            }
            int read;
            while ((read = in.read(chunk)) != -1) {
                if (accumulated.size() + read > maxBodyBytes) {
                    LOG.warn("Request body too large: {} {} (limit {} bytes)", request.method(), request.path(),
                            maxBodyBytes);
                    throw new BodyTooLargeException(maxBodyBytes);
                }
                accumulated.write(chunk, 0, read);
            }
        } catch (IOException e) {
            throw new BodyReadException(e);
        }
        return accumulated.toByteArray();
    }

    private static BodyContent parseBody(BodyType bodyType, byte[] bytes) {
        String decoded = decodeUtf8(bytes);
        return switch (bodyType) {
            case JSON -> new BodyContent.Json(parseJson(decoded));
            case FORM -> new BodyContent.Form(decoded);
            case TEXT -> new BodyContent.Text(decoded);
        };
    }

    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidUtf8Exception(e);
        }
    }

    private static JsonNode parseJson(String text) {
        JsonNode node;
        try {
            node = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new InvalidJsonException(e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new InvalidJsonException("no content to parse");
        }
        return node;
    }
}

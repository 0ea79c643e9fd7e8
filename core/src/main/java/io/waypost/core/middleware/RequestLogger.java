package io.waypost.core.middleware;

import io.waypost.core.chain.Middleware;
import io.waypost.core.chain.Next;
import io.waypost.core.model.RequestContext;
import io.waypost.core.model.ResponseBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Access-log middleware. Forwards to the rest of the chain, then writes one
 * INFO line with the fields enabled in its {@link RequestLoggerConfig}:
 *
 * <pre>
 * path: /users/42, duration: 3ms, method: GET
 * </pre>
 *
 * <p>
 * Nothing is logged when the chain throws; {@link io.waypost.core.app.App}
 * logs those failures itself. Register it first so the duration covers every
 * other middleware.
 */
public final class RequestLogger implements Middleware {

    private static final Logger LOG = LoggerFactory.getLogger(RequestLogger.class);

    private final RequestLoggerConfig config;
    private final String pattern;

    public RequestLogger() {
        this(RequestLoggerConfig.DEFAULT);
    }

    public RequestLogger(RequestLoggerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.pattern = pattern(config);
    }

    @Override
    public ResponseBuilder handle(RequestContext request, ResponseBuilder response, Next next) throws Exception {
        long startNanos = System.nanoTime();
        ResponseBuilder result = next.run(request, response);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        if (config.anyEnabled()) {
            LOG.info(pattern, arguments(request, elapsedMillis));
        }
        return result;
    }

    /** SLF4J message pattern with one placeholder per enabled field. */
    static String pattern(RequestLoggerConfig config) {
        StringJoiner line = new StringJoiner(", ");
        if (config.path()) {
            line.add("path: {}");
        }
        if (config.duration()) {
            line.add("duration: {}ms");
        }
        if (config.method()) {
            line.add("method: {}");
        }
        return line.toString();
    }

    Object[] arguments(RequestContext request, long elapsedMillis) {
        List<Object> args = new ArrayList<>(3);
        if (config.path()) {
            args.add(request.path());
        }
        if (config.duration()) {
            args.add(elapsedMillis);
        }
        if (config.method()) {
            args.add(request.method());
        }
        return args.toArray();
    }

    public RequestLoggerConfig config() {
        return config;
    }
}

package io.waypost.javalin.adapter;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HandlerType;
import io.waypost.core.error.TransportBindException;
import io.waypost.core.spi.BindAddress;
import io.waypost.core.spi.RequestDispatcher;
import io.waypost.core.spi.TransportResponse;
import io.waypost.core.spi.TransportServer;
import jakarta.servlet.http.Cookie;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransportServer} on Javalin 6 (embedded Jetty).
 *
 * <p>
 * Javalin's own router only catches everything: a single handler is
 * registered on {@code /} and {@code /<path>} for every method Javalin knows,
 * and each request is handed to the core {@link RequestDispatcher}. Route
 * matching, 404s and methods outside the core's set are all decided by the
 * core.
 *
 * <p>
 * One instance serves one start/stop cycle.
 */
public final class JavalinTransport implements TransportServer {

    private static final Logger LOG = LoggerFactory.getLogger(JavalinTransport.class);

    private static final List<HandlerType> METHODS = List.of(
            HandlerType.GET,
            HandlerType.POST,
            HandlerType.PUT,
            HandlerType.DELETE,
            HandlerType.PATCH,
            HandlerType.HEAD,
            HandlerType.OPTIONS);

    private Javalin javalin;

    @Override
    public synchronized void start(BindAddress address, RequestDispatcher dispatcher) {
        if (javalin != null) {
            throw new IllegalStateException("Transport already started");
        }
        Javalin app = Javalin.create(config -> config.showJavalinBanner = false);
        for (HandlerType method : METHODS) {
            app.addHttpHandler(method, "/", ctx -> serve(ctx, dispatcher));
            app.addHttpHandler(method, "/<path>", ctx -> serve(ctx, dispatcher));
        }
        try {
            app.start(address.host(), address.port());
        } catch (RuntimeException e) {
            TransportBindException failure = new TransportBindException(address.toString(), e);
            try {
                app.stop();
            } catch (RuntimeException stopFailure) {
                failure.addSuppressed(stopFailure);
            }
            throw failure;
        }
        javalin = app;
        LOG.debug("Javalin transport bound to {}:{}", address.host(), app.port());
    }

    @Override
    public synchronized int port() {
        if (javalin == null) {
            throw new IllegalStateException("Transport not started");
        }
        return javalin.port();
    }

    @Override
    public synchronized void stop() {
        if (javalin != null) {
            javalin.stop();
            javalin = null;
        }
    }

    static void serve(Context ctx, RequestDispatcher dispatcher) {
        TransportResponse response = dispatcher.dispatch(new JavalinTransportRequest(ctx));
        write(response, ctx);
    }

    /** Copies a core response onto the Javalin context. */
    static void write(TransportResponse response, Context ctx) {
        ctx.status(response.status());
        ctx.contentType(response.contentType());
        for (Map.Entry<String, String> header : response.headers().entrySet()) {
            ctx.header(header.getKey(), header.getValue());
        }
        for (Map.Entry<String, String> cookie : response.cookies().entrySet()) {
            Cookie servletCookie = new Cookie(cookie.getKey(), cookie.getValue());
            servletCookie.setPath("/");
            ctx.res().addCookie(servletCookie);
        }
        for (String name : response.clearedCookies()) {
            Cookie expired = new Cookie(name, "");
            expired.setPath("/");
            expired.setMaxAge(0);
            ctx.res().addCookie(expired);
        }
        ctx.result(response.body());
    }
}

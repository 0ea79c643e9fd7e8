package io.waypost.javalin.adapter;

import io.javalin.http.Context;
import io.waypost.core.spi.TransportRequest;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;

/**
 * {@link TransportRequest} view of a Javalin {@link Context}.
 *
 * <p>
 * Reads straight from the servlet request so nothing is normalized: header
 * names keep their received case, every value of a repeated header becomes its
 * own pair, and the query string stays percent-encoded. Path captures are left
 * to the core router, so {@link #pathParams()} is always empty.
 *
 * <p>
 * The body is exposed as the raw servlet stream; Javalin's buffered
 * {@code ctx.body()} is never touched, so the core's byte cap applies.
 */
public final class JavalinTransportRequest implements TransportRequest {

    private final Context ctx;

    public JavalinTransportRequest(Context ctx) {
        this.ctx = ctx;
    }

    @Override
    public String method() {
        return ctx.method().name();
    }

    @Override
    public String path() {
        return ctx.path();
    }

    @Override
    public String queryString() {
        return ctx.queryString();
    }

    @Override
    public List<Map.Entry<String, String>> headers() {
        HttpServletRequest req = ctx.req();
        List<Map.Entry<String, String>> pairs = new ArrayList<>();
        Enumeration<String> names = req.getHeaderNames();
        if (names == null) {
            return pairs;
        }
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            Enumeration<String> values = req.getHeaders(name);
            if (values == null) {
                continue;
            }
            while (values.hasMoreElements()) {
                pairs.add(Map.entry(name, values.nextElement()));
            }
        }
        return pairs;
    }

    @Override
    public List<Map.Entry<String, String>> cookies() {
        Cookie[] cookies = ctx.req().getCookies();
        if (cookies == null) {
            return Collections.emptyList();
        }
        List<Map.Entry<String, String>> pairs = new ArrayList<>(cookies.length);
        for (Cookie cookie : cookies) {
            pairs.add(Map.entry(cookie.getName(), cookie.getValue() != null ? cookie.getValue() : ""));
        }
        return pairs;
    }

    @Override
    public Map<String, String> pathParams() {
        return Map.of();
    }

    @Override
    public InputStream body() throws IOException {
        return ctx.req().getInputStream();
    }

    @Override
    public String peerAddress() {
        return ctx.req().getRemoteAddr();
    }
}

package io.waypost.core.app;

import io.waypost.core.chain.Handler;
import io.waypost.core.chain.Middleware;
import io.waypost.core.chain.MiddlewareChain;
import io.waypost.core.chain.MiddlewareRegistry;
import io.waypost.core.error.RequestRejectedException;
import io.waypost.core.model.HttpMethod;
import io.waypost.core.model.ProblemDetail;
import io.waypost.core.model.RequestContext;
import io.waypost.core.model.ResponseBuilder;
import io.waypost.core.routing.RouteMatch;
import io.waypost.core.routing.RouteRegistry;
import io.waypost.core.spi.BindAddress;
import io.waypost.core.spi.RequestDispatcher;
import io.waypost.core.spi.TransportRequest;
import io.waypost.core.spi.TransportResponse;
import io.waypost.core.spi.TransportServer;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition root: owns the route and middleware registries and bridges
 * each transport request through {@link RequestContextFactory}, the resolved
 * {@link MiddlewareChain} and back to a {@link TransportResponse}.
 *
 * <p>
 * Lifecycle: register routes and middlewares, then {@link #start} or
 * {@link #listen}. Starting freezes both registries into immutable snapshots;
 * any later registration fails with {@link IllegalStateException}.
 *
 * <p>
 * Per-request failures never stop the server:
 * <ul>
 * <li>{@link RequestRejectedException} is answered with its problem response
 * before any middleware runs.</li>
 * <li>An unmatched route runs the middleware chain terminated by a built-in
 * 404 handler.</li>
 * <li>Any other exception escaping the chain is logged and answered with a
 * 500 problem response.</li>
 * </ul>
 *
 * <p>
 * {@link #dispatch} is thread-safe once started.
 */
public final class App implements RequestDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    private static final Handler NOT_FOUND = (req, res) ->
            res.problem(ProblemDetail.notFound("No route for " + req.method() + " " + req.path(), req.path()));

    private final TransportServer server;
    private final RequestContextFactory contextFactory;
    private final RouteRegistry routes = new RouteRegistry();
    private final MiddlewareRegistry middlewares = new MiddlewareRegistry();

    private volatile RouteRegistry frozenRoutes;
    private volatile MiddlewareRegistry frozenMiddlewares;

    public App(TransportServer server) {
        this(server, new RequestContextFactory());
    }

    App(TransportServer server, RequestContextFactory contextFactory) {
        this.server = Objects.requireNonNull(server, "server");
        this.contextFactory = Objects.requireNonNull(contextFactory, "contextFactory");
    }

    // ── Route registration ──

    public App get(String path, Handler handler) {
        return route(HttpMethod.GET, path, handler);
    }

    public App post(String path, Handler handler) {
        return route(HttpMethod.POST, path, handler);
    }

    public App put(String path, Handler handler) {
        return route(HttpMethod.PUT, path, handler);
    }

    public App patch(String path, Handler handler) {
        return route(HttpMethod.PATCH, path, handler);
    }

    public App delete(String path, Handler handler) {
        return route(HttpMethod.DELETE, path, handler);
    }

    /**
     * Appends a route. Duplicates are accepted; the first registration wins at
     * dispatch.
     *
     * @throws IllegalStateException    if the app is already serving
     * @throws IllegalArgumentException if the path template is malformed
     */
    public App route(HttpMethod method, String path, Handler handler) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(handler, "handler");
        ensureNotStarted();
        routes.register(method, path, handler);
        LOG.debug("Registered route {} {}", method, path);
        return this;
    }

    // ── Middleware registration ──

    /** Appends a middleware applied to every path starting with {@code prefix}. */
    public App use(String prefix, Middleware middleware) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(middleware, "middleware");
        ensureNotStarted();
        middlewares.register(prefix, middleware);
        LOG.debug("Registered middleware for prefix '{}'", prefix);
        return this;
    }

    /** Appends a middleware applied to every request. */
    public App use(Middleware middleware) {
        return use("", middleware);
    }

    // ── Lifecycle ──

    /**
     * Binds {@code address} ({@code host:port}) and starts serving.
     *
     * @throws io.waypost.core.error.TransportBindException if the address cannot be bound
     * @throws IllegalArgumentException                     if the address is malformed
     * @throws IllegalStateException                        if already started
     */
    public RunningApp start(String address) {
        return start(BindAddress.parse(address));
    }

    public synchronized RunningApp start(BindAddress address) {
        ensureNotStarted();
        frozenRoutes = routes.snapshot();
        frozenMiddlewares = middlewares.snapshot();
        server.start(address, this);
        LOG.info(
                "waypost listening on {}:{} ({} routes, {} middlewares)",
                address.host(),
                server.port(),
                frozenRoutes.size(),
                frozenMiddlewares.size());
        return new RunningApp(server);
    }

    /**
     * Starts serving and blocks the calling thread until the server is
     * stopped or the thread is interrupted.
     */
    public void listen(String address) throws InterruptedException {
        start(address).await();
    }

    public boolean isStarted() {
        return frozenRoutes != null;
    }

    private void ensureNotStarted() {
        if (isStarted()) {
            throw new IllegalStateException("Cannot register routes or middlewares after the app has started");
        }
    }

    // ── Dispatch ──

    /**
     * Runs one request through construction, dispatch and the chain.
     * Never throws for per-request failures.
     */
    @Override
    public TransportResponse dispatch(TransportRequest request) {
        RouteRegistry activeRoutes = frozenRoutes != null ? frozenRoutes : routes;
        MiddlewareRegistry activeMiddlewares = frozenMiddlewares != null ? frozenMiddlewares : middlewares;

        String path = request.path();
        Optional<RouteMatch> match =
                HttpMethod.parse(request.method()).flatMap(method -> activeRoutes.dispatch(method, path));
        Map<String, String> captures = match.map(RouteMatch::params).orElse(Map.of());

        RequestContext context;
        try {
            context = contextFactory.create(request, captures);
        } catch (RequestRejectedException e) {
            LOG.warn("Rejected {} {}: {} ({})", request.method(), path, e.getMessage(), e.status());
            return ResponseBuilder.create().problem(e.toProblem(path)).toTransport();
        }

        Handler terminal = match.map(m -> m.route().handler()).orElse(NOT_FOUND);
        if (match.isEmpty()) {
            LOG.debug("No route for {} {}", request.method(), path);
        } else {
            LOG.debug("Dispatching {} {} -> {}", request.method(), path, match.get().route().path());
        }

        MiddlewareChain chain = activeMiddlewares.resolve(path, terminal);
        try {
            return chain.execute(context, ResponseBuilder.create()).toTransport();
        } catch (Exception e) {
            LOG.error("Request {} {} failed: {}", request.method(), path, e.getMessage(), e);
            return ResponseBuilder.create()
                    .problem(ProblemDetail.internalError("Internal server error", path))
                    .toTransport();
        }
    }
}

package io.waypost.javalin.server;

import io.waypost.core.app.App;
import io.waypost.core.app.RunningApp;
import io.waypost.core.middleware.RequestLogger;
import io.waypost.javalin.adapter.JavalinTransport;
import io.waypost.javalin.config.ConfigLoader;
import io.waypost.javalin.config.ServerConfig;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence for a waypost application on Javalin.
 *
 * <ol>
 * <li>Load configuration from YAML and the environment</li>
 * <li>Configure Logback</li>
 * <li>Create the {@link App} on a {@link JavalinTransport}</li>
 * <li>Install {@link RequestLogger} first, if enabled</li>
 * <li>Run the caller's setup (routes and middlewares)</li>
 * <li>Bind and start serving</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.waypost.javalin.WaypostMain} so tests can start a
 * server without going through {@code main()}.
 */
public final class Launcher {

    private static final Logger LOG = LoggerFactory.getLogger(Launcher.class);

    private Launcher() {
        // utility class
    }

    /**
     * Loads configuration from {@code args} and the environment, then starts.
     *
     * @throws io.waypost.javalin.config.ConfigLoadException   on invalid configuration
     * @throws io.waypost.core.error.TransportBindException if the address cannot be bound
     */
    public static RunningApp start(String[] args, Consumer<App> setup) {
        ServerConfig config = ConfigLoader.load(args);
        LogbackConfigurator.configure(config);
        LOG.info("Configuration loaded: {}:{}, logging={}/{}", config.host(), config.port(),
                config.loggingFormat(), config.loggingLevel());
        return start(config, setup);
    }

    /** Starts with an already resolved configuration. Logging is left as is. */
    public static RunningApp start(ServerConfig config, Consumer<App> setup) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(setup, "setup");
        long startTime = System.nanoTime();

        App app = new App(new JavalinTransport());
        if (config.requestLogEnabled()) {
            app.use(new RequestLogger(config.requestLoggerConfig()));
        }
        setup.accept(app);

        RunningApp running = app.start(config.bindAddress());
        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info("waypost started: port={}, requestLog={}, startupMs={}", running.port(),
                config.requestLogEnabled(), elapsedMs);
        return running;
    }

    /**
     * Starts and blocks until the server stops. A JVM shutdown hook stops the
     * server on SIGTERM.
     */
    public static void listen(String[] args, Consumer<App> setup) throws InterruptedException {
        RunningApp running = start(args, setup);
        Runtime.getRuntime().addShutdownHook(new Thread(running::stop, "waypost-shutdown"));
        running.await();
    }
}

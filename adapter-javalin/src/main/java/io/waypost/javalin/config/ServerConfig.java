package io.waypost.javalin.config;

import io.waypost.core.middleware.RequestLoggerConfig;
import io.waypost.core.spi.BindAddress;

/**
 * Runtime configuration for a waypost server on Javalin.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances;
 * {@link ConfigLoader} fills the builder from YAML and the environment.
 *
 * @param host               interface to bind
 * @param port               listen port, 0 for an ephemeral port
 * @param loggingFormat      {@code text} or {@code json}
 * @param loggingLevel       root log level
 * @param requestLogEnabled  install the request logger ahead of user middlewares
 * @param requestLogMethod   include the method in request log lines
 * @param requestLogPath     include the path in request log lines
 * @param requestLogDuration include the elapsed time in request log lines
 */
public record ServerConfig(
        String host,
        int port,
        String loggingFormat,
        String loggingLevel,
        boolean requestLogEnabled,
        boolean requestLogMethod,
        boolean requestLogPath,
        boolean requestLogDuration) {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8080;

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** All defaults, no file and no environment. */
    public static ServerConfig defaults() {
        return builder().build();
    }

    public BindAddress bindAddress() {
        return new BindAddress(host, port);
    }

    public RequestLoggerConfig requestLoggerConfig() {
        return new RequestLoggerConfig(requestLogMethod, requestLogPath, requestLogDuration);
    }

    /** Builder for {@link ServerConfig}. */
    public static final class Builder {

        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private boolean requestLogEnabled = true;
        private boolean requestLogMethod = true;
        private boolean requestLogPath = true;
        private boolean requestLogDuration = true;

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder requestLogEnabled(boolean requestLogEnabled) {
            this.requestLogEnabled = requestLogEnabled;
            return this;
        }

        public Builder requestLogMethod(boolean requestLogMethod) {
            this.requestLogMethod = requestLogMethod;
            return this;
        }

        public Builder requestLogPath(boolean requestLogPath) {
            this.requestLogPath = requestLogPath;
            return this;
        }

        public Builder requestLogDuration(boolean requestLogDuration) {
            this.requestLogDuration = requestLogDuration;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(
                    host,
                    port,
                    loggingFormat,
                    loggingLevel,
                    requestLogEnabled,
                    requestLogMethod,
                    requestLogPath,
                    requestLogDuration);
        }
    }
}

package io.waypost.javalin.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.waypost.javalin.config.ServerConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the logging half of a {@link ServerConfig} to Logback at startup.
 *
 * <p>
 * {@code logging.format} (env {@code LOG_FORMAT}) selects the encoder:
 * {@code json} installs Logback's {@link JsonEncoder}, so every access line
 * from {@link io.waypost.core.middleware.RequestLogger} becomes one JSON
 * object; {@code text} uses {@link #TEXT_PATTERN}. {@code logging.level} (env
 * {@code LOG_LEVEL}) sets the root level. {@link Launcher} calls this before
 * the app is created; the root logger's appenders are replaced each time.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
    static final String APPENDER_NAME = "STDOUT";

    private LogbackConfigurator() {
        // utility class
    }

    public static void configure(ServerConfig config) {
        configure(config.loggingFormat(), config.loggingLevel());
    }

    /**
     * @param format {@code json} for structured output, anything else for text
     * @param level  root level name; unknown names fall back to INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.INFO));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(encoderFor(format, context));
        appender.start();
        rootLogger.addAppender(appender);

        // Jetty is chatty at INFO
        context.getLogger("org.eclipse.jetty").setLevel(Level.WARN);
        context.getLogger("io.javalin").setLevel(Level.INFO);
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            return encoder;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}

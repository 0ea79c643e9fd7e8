package io.waypost.javalin.server;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import io.waypost.javalin.config.ServerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("LogbackConfigurator")
class LogbackConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void restoreTestLogging() {
        LogbackConfigurator.configure("text", "WARN");
    }

    @SuppressWarnings("unchecked")
    private ConsoleAppender<ILoggingEvent> consoleAppender() {
        return (ConsoleAppender<ILoggingEvent>) root.getAppender(LogbackConfigurator.APPENDER_NAME);
    }

    @Test
    @DisplayName("json format installs the JSON encoder")
    void jsonFormat() {
        LogbackConfigurator.configure("json", "DEBUG");

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(consoleAppender().getEncoder()).isInstanceOf(JsonEncoder.class);
    }

    @Test
    @DisplayName("text format installs the pattern encoder")
    void textFormat() {
        LogbackConfigurator.configure("text", "INFO");

        assertThat(consoleAppender().getEncoder())
                .isInstanceOfSatisfying(PatternLayoutEncoder.class, encoder -> assertThat(encoder.getPattern())
                        .isEqualTo(LogbackConfigurator.TEXT_PATTERN));
    }

    @Test
    @DisplayName("ServerConfig logging settings are applied")
    void fromServerConfig() {
        ServerConfig config =
                ServerConfig.builder().loggingFormat("json").loggingLevel("ERROR").build();

        LogbackConfigurator.configure(config);

        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
        assertThat(consoleAppender().getEncoder()).isInstanceOf(JsonEncoder.class);
    }

    @Test
    @DisplayName("unknown level falls back to INFO; Jetty stays at WARN")
    void levelFallback() {
        LogbackConfigurator.configure("text", "LOUD");

        assertThat(root.getLevel()).isEqualTo(Level.INFO);
        assertThat(context.getLogger("org.eclipse.jetty").getLevel()).isEqualTo(Level.WARN);
    }
}

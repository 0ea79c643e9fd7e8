package io.waypost.core.middleware;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.waypost.core.chain.Handler;
import io.waypost.core.chain.MiddlewareChain;
import io.waypost.core.model.RequestContext;
import io.waypost.core.model.ResponseBuilder;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("RequestLogger")
class RequestLoggerTest {

    private static final RequestContext REQUEST =
            RequestContext.builder().method("POST").path("/orders").build();

    private ListAppender<ILoggingEvent> logAppender;
    private Logger logger;
    private Level previousLevel;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(RequestLogger.class);
        previousLevel = logger.getLevel();
        logger.setLevel(Level.INFO);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(logAppender);
        logger.setLevel(previousLevel);
        logAppender.stop();
    }

    private ResponseBuilder run(RequestLogger requestLogger, Handler handler) throws Exception {
        return new MiddlewareChain(List.of(requestLogger), handler).execute(REQUEST, ResponseBuilder.create());
    }

    @Test
    @DisplayName("default config logs path, duration and method after the handler")
    void logsAllFields() throws Exception {
        ResponseBuilder result = run(new RequestLogger(), (req, res) -> res.status(201).text("created"));

        assertThat(result.statusCode()).isEqualTo(201);
        assertThat(logAppender.list).hasSize(1);
        ILoggingEvent event = logAppender.list.get(0);
        assertThat(event.getLevel()).isEqualTo(Level.INFO);
        assertThat(event.getFormattedMessage())
                .startsWith("path: /orders, duration: ")
                .endsWith("ms, method: POST");
    }

    @Test
    @DisplayName("disabled fields are left out")
    void respectsFlags() throws Exception {
        run(new RequestLogger(new RequestLoggerConfig(true, false, false)), (req, res) -> res);

        assertThat(logAppender.list).extracting(ILoggingEvent::getFormattedMessage).containsExactly("method: POST");
    }

    @Test
    @DisplayName("all fields disabled → nothing logged")
    void allDisabled() throws Exception {
        run(new RequestLogger(new RequestLoggerConfig(false, false, false)), (req, res) -> res);

        assertThat(logAppender.list).isEmpty();
    }

    @Test
    @DisplayName("a failing handler propagates and is not logged here")
    void failureNotLogged() {
        RequestLogger requestLogger = new RequestLogger();

        assertThatThrownBy(() -> run(requestLogger, (req, res) -> {
                    throw new IllegalStateException("boom");
                }))
                .isInstanceOf(IllegalStateException.class);
        assertThat(logAppender.list).isEmpty();
    }

    @Test
    @DisplayName("fields are passed as placeholder arguments")
    void placeholderArguments() throws Exception {
        run(new RequestLogger(new RequestLoggerConfig(false, true, true)), (req, res) -> res);

        ILoggingEvent event = logAppender.list.get(0);
        assertThat(event.getMessage()).isEqualTo("path: {}, duration: {}ms");
        assertThat(event.getArgumentArray()).hasSize(2);
        assertThat(event.getArgumentArray()[0]).isEqualTo("/orders");
    }

    @Test
    @DisplayName("arguments report the elapsed time they are given")
    void argumentsUseElapsed() {
        RequestLogger requestLogger = new RequestLogger(new RequestLoggerConfig(false, false, true));

        assertThat(RequestLogger.pattern(requestLogger.config())).isEqualTo("duration: {}ms");
        assertThat(requestLogger.arguments(REQUEST, 17)).containsExactly(17L);
    }
}

package io.imagexform.standalone.app;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogbackConfiguratorTest {

    private final Logger root =
            ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void restore() {
        LogbackConfigurator.configure("text", "WARN");
    }

    private ConsoleAppender<ILoggingEvent> appender() {
        return (ConsoleAppender<ILoggingEvent>) root.getAppender(LogbackConfigurator.APPENDER_NAME);
    }

    @Test
    void jsonFormatUsesJsonEncoder() {
        LogbackConfigurator.configure("json", "DEBUG");

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender().getEncoder()).isInstanceOf(JsonEncoder.class);
        assertThat(appender().getTarget()).isEqualTo("System.err");
    }

    @Test
    void textFormatUsesPatternWithEngine() {
        LogbackConfigurator.configure("text", "INFO");

        assertThat(appender().getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) appender().getEncoder()).getPattern()).contains("%X{pipeline_engine}");
    }

    @Test
    void unknownLevelFallsBackToInfo() {
        LogbackConfigurator.configure("text", "LOUD");

        assertThat(root.getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void replacesPreviousAppenders() {
        LogbackConfigurator.configure("text", "INFO");
        LogbackConfigurator.configure("json", "INFO");

        assertThat(root.iteratorForAppenders()).toIterable().hasSize(1);
    }
}

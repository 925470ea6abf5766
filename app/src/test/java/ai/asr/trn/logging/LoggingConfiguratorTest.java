package ai.asr.trn.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.asr.trn.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    @AfterEach
    void restoreTextFormat() {
        LoggingConfigurator.configure(LogFormat.TEXT);
    }

    @Test
    void switchesRootAppenderToJsonLayout() {
        int reconfigured = LoggingConfigurator.configure(LogFormat.JSON);

        OutputStreamAppender<?> appender = rootStreamAppender();
        assertThat(reconfigured).isEqualTo(1);
        assertThat(appender.getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<?>) appender.getEncoder()).getLayout()).isInstanceOf(SimpleJsonLayout.class);
        assertThat(appender.isStarted()).isTrue();
    }

    @Test
    void switchesBackToPatternLayout() {
        LoggingConfigurator.configure(LogFormat.JSON);
        LoggingConfigurator.configure(LogFormat.TEXT);

        OutputStreamAppender<?> appender = rootStreamAppender();
        assertThat(appender.getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) appender.getEncoder()).getPattern()).isEqualTo(LoggingConfigurator.TEXT_PATTERN);
    }

    private static OutputStreamAppender<?> rootStreamAppender() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        return (OutputStreamAppender<?>) root.getAppender("STDERR");
    }
}

package ai.regula.ingest.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.regula.ingest.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
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
    void jsonFormatInstallsJsonLayout() {
        LoggingConfigurator.configure(LogFormat.JSON);

        Encoder<ILoggingEvent> encoder = rootEncoder();
        assertThat(encoder).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) encoder).getLayout()).isInstanceOf(JsonLogLayout.class);
    }

    @Test
    void textFormatInstallsPattern() {
        LoggingConfigurator.configure(LogFormat.JSON);
        LoggingConfigurator.configure(LogFormat.TEXT);

        Encoder<ILoggingEvent> encoder = rootEncoder();
        assertThat(encoder).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) encoder).getPattern()).isEqualTo(LoggingConfigurator.TEXT_PATTERN);
    }

    private static Encoder<ILoggingEvent> rootEncoder() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        OutputStreamAppender<ILoggingEvent> appender = (OutputStreamAppender<ILoggingEvent>)
                context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDERR");
        assertThat(appender.isStarted()).isTrue();
        return appender.getEncoder();
    }
}

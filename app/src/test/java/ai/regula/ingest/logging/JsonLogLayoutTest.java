package ai.regula.ingest.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonLogLayoutTest {

    private final LoggerContext context = new LoggerContext();

    @Test
    void formatsEventAsJson() throws Exception {
        JsonLogLayout layout = startedLayout();
        LoggingEvent event = event("Parsed \"gdpr.txt\"");
        event.setMDCPropertyMap(Map.of());

        String json = layout.doLayout(event);

        JsonNode node = new ObjectMapper().readTree(json);
        assertThat(node.get("message").asText()).isEqualTo("Parsed \"gdpr.txt\"");
        assertThat(node.get("logger").asText()).isEqualTo("test.logger");
        assertThat(node.get("level").asText()).isEqualTo("INFO");
        assertThat(node.get("timestamp").asText()).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(node.has("mdc")).isFalse();
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesMdcAndException() throws Exception {
        JsonLogLayout layout = startedLayout();
        LoggingEvent event = event("failed");
        event.setMDCPropertyMap(Map.of("input", "act.txt"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        JsonNode node = new ObjectMapper().readTree(layout.doLayout(event));

        assertThat(node.at("/mdc/input").asText()).isEqualTo("act.txt");
        assertThat(node.get("exception").asText()).contains("IllegalStateException: boom");
    }

    private JsonLogLayout startedLayout() {
        context.start();
        JsonLogLayout layout = new JsonLogLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}

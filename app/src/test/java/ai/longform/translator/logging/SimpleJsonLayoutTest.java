package ai.longform.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void formatsEventAsJson() throws Exception {
        String json = layout().doLayout(event("hello world"));

        JsonNode node = mapper.readTree(json);
        assertThat(node.get("message").asText()).isEqualTo("hello world");
        assertThat(node.get("logger").asText()).isEqualTo("test.logger");
        assertThat(node.get("level").asText()).isEqualTo("INFO");
        assertThat(node.get("timestamp").asText()).startsWith("1970-01-01T00:00");
        assertThat(node.has("mdc")).isFalse();
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void promotesTaskContextAndNestsOtherMdcEntries() throws Exception {
        LoggingEvent event = event("sending batch");
        event.setMDCPropertyMap(Map.of("taskId", "batch-3", "round", "1", "document", "book.json"));

        JsonNode node = mapper.readTree(layout().doLayout(event));

        assertThat(node.get("taskId").asText()).isEqualTo("batch-3");
        assertThat(node.get("round").asText()).isEqualTo("1");
        assertThat(node.get("mdc").get("document").asText()).isEqualTo("book.json");
        assertThat(node.get("mdc").has("taskId")).isFalse();
    }

    @Test
    void includesStackTraceOfThrowable() throws Exception {
        LoggingEvent event = event("request failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        JsonNode node = mapper.readTree(layout().doLayout(event));

        assertThat(node.get("exception").asText()).contains("IllegalStateException").contains("boom");
    }

    private static SimpleJsonLayout layout() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(new LoggerContext());
        return event;
    }
}

package ai.longform.translator.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * One JSON object per log line. The task id and round of executor threads are top-level fields
 * so log processors can group a task's lines; any other MDC entries go under {@code mdc}.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    static final List<String> PROMOTED_MDC_KEYS = List.of("taskId", "round");
    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String doLayout(ILoggingEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        node.put("level", event.getLevel().toString());
        node.put("logger", event.getLoggerName());
        node.put("thread", event.getThreadName());
        node.put("message", event.getFormattedMessage());

        Map<String, String> mdc = safeMdc(event);
        for (String key : PROMOTED_MDC_KEYS) {
            String value = mdc.get(key);
            if (value != null) {
                node.put(key, value);
            }
        }
        ObjectNode rest = MAPPER.createObjectNode();
        mdc.forEach((key, value) -> {
            if (!PROMOTED_MDC_KEYS.contains(key)) {
                rest.put(key, value);
            }
        });
        if (!rest.isEmpty()) {
            node.set("mdc", rest);
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            node.put("exception", ThrowableProxyUtil.asString(throwable));
        }
        try {
            return MAPPER.writeValueAsString(node) + System.lineSeparator();
        } catch (JsonProcessingException ex) {
            return "{\"level\":\"ERROR\",\"message\":\"log event could not be serialized\"}" + System.lineSeparator();
        }
    }

    private Map<String, String> safeMdc(ILoggingEvent event) {
        Map<String, String> map = event.getMDCPropertyMap();
        return map == null ? Map.of() : map;
    }
}

package ai.longform.translator.writer;

import ai.longform.translator.translate.ResponseLog;
import ai.longform.translator.translate.ResponseLogEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Exports the raw response log as JSON Lines, one entry per line in completion order.
 */
public class ResponseLogWriter {

    private final ObjectMapper mapper = JsonSupport.mapper();

    public void write(Path target, ResponseLog responseLog) {
        if (target == null || responseLog == null) {
            throw new IllegalArgumentException("target and responseLog must be provided");
        }
        try {
            DocumentWriter.createParent(target);
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                for (ResponseLogEntry entry : responseLog.entries()) {
                    writer.write(mapper.writeValueAsString(toJson(entry)));
                    writer.newLine();
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write response log: " + target, ex);
        }
    }

    private ObjectNode toJson(ResponseLogEntry entry) {
        ObjectNode node = mapper.createObjectNode();
        node.put("task_id", entry.taskId());
        node.put("variant", entry.variant().name().toLowerCase(Locale.ROOT));
        node.put("round", entry.round());
        node.put("attempt", entry.attempt());
        node.put("completed_at", entry.completedAt().toString());
        entry.response().ifPresent(response -> node.put("response", response));
        entry.error().ifPresent(error -> node.put("error", error));
        return node;
    }
}

package ai.longform.translator.writer;

import static org.assertj.core.api.Assertions.assertThat;

import ai.longform.translator.plan.TaskVariant;
import ai.longform.translator.translate.ResponseLog;
import ai.longform.translator.translate.ResponseLogEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResponseLogWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOneJsonObjectPerEntryInCompletionOrder() throws Exception {
        ResponseLog log = new ResponseLog();
        log.append(new ResponseLogEntry("batch-0", TaskVariant.BATCH, 0, 1, Instant.parse("2024-01-01T00:00:00Z"),
                Optional.empty(), Optional.of("429 Too Many Requests")));
        log.append(new ResponseLogEntry("batch-0", TaskVariant.BATCH, 0, 2, Instant.parse("2024-01-01T00:00:05Z"),
                Optional.of("<segments>\n</segments>"), Optional.empty()));
        Path target = tempDir.resolve("logs/responses.jsonl");

        new ResponseLogWriter().write(target, log);

        List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        ObjectMapper mapper = new ObjectMapper();
        JsonNode first = mapper.readTree(lines.get(0));
        JsonNode second = mapper.readTree(lines.get(1));
        assertThat(first.get("task_id").asText()).isEqualTo("batch-0");
        assertThat(first.get("variant").asText()).isEqualTo("batch");
        assertThat(first.get("error").asText()).isEqualTo("429 Too Many Requests");
        assertThat(first.has("response")).isFalse();
        assertThat(second.get("attempt").asInt()).isEqualTo(2);
        assertThat(second.get("completed_at").asText()).isEqualTo("2024-01-01T00:00:05Z");
        assertThat(second.get("response").asText()).isEqualTo("<segments>\n</segments>");
    }

    @Test
    void emptyLogProducesEmptyFile() throws Exception {
        Path target = tempDir.resolve("responses.jsonl");

        new ResponseLogWriter().write(target, new ResponseLog());

        assertThat(Files.readString(target)).isEmpty();
    }
}

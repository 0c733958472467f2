package ai.longform.translator.translate;

import ai.longform.translator.plan.TaskVariant;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One raw response, or one failed attempt, as it came back from the completion client.
 */
public record ResponseLogEntry(String taskId,
                               TaskVariant variant,
                               int round,
                               int attempt,
                               Instant completedAt,
                               Optional<String> response,
                               Optional<String> error) {

    public ResponseLogEntry {
        taskId = Objects.requireNonNull(taskId, "taskId");
        variant = Objects.requireNonNull(variant, "variant");
        completedAt = Objects.requireNonNull(completedAt, "completedAt");
        response = response == null ? Optional.empty() : response;
        error = error == null ? Optional.empty() : error;
    }
}

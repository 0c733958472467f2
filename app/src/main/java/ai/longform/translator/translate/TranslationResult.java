package ai.longform.translator.translate;

import ai.longform.translator.plan.TaskVariant;
import ai.longform.translator.plan.TranslationTask;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one task. Every requested unit id is a key of {@code perUnit}; ids the response
 * did not cover map to {@link Optional#empty()}.
 */
public record TranslationResult(TranslationTask task,
                                Optional<String> rawResponse,
                                Map<String, Optional<String>> perUnit,
                                Optional<String> failure) {

    public TranslationResult {
        task = Objects.requireNonNull(task, "task");
        rawResponse = rawResponse == null ? Optional.empty() : rawResponse;
        failure = failure == null ? Optional.empty() : failure;
        Map<String, Optional<String>> complete = new LinkedHashMap<>();
        for (String id : task.unitIds()) {
            Optional<String> text = perUnit == null ? null : perUnit.get(id);
            complete.put(id, text == null ? Optional.empty() : text);
        }
        perUnit = Collections.unmodifiableMap(complete);
    }

    public static TranslationResult success(TranslationTask task, String rawResponse,
                                            Map<String, Optional<String>> perUnit) {
        return new TranslationResult(task, Optional.ofNullable(rawResponse), perUnit, Optional.empty());
    }

    public static TranslationResult failed(TranslationTask task, String rawResponse, String failure) {
        return new TranslationResult(task, Optional.ofNullable(rawResponse), Map.of(), Optional.of(failure));
    }

    public String taskId() {
        return task.taskId();
    }

    public TaskVariant variant() {
        return task.variant();
    }

    public boolean isFailed() {
        return failure.isPresent();
    }
}

package ai.longform.translator.plan;

import java.util.List;

/**
 * One ordered part of a container that exceeds the token budget on its own.
 */
public record SplitTask(String taskId,
                        String containerId,
                        int partIndex,
                        int totalParts,
                        List<String> unitIds) implements TranslationTask {

    public SplitTask {
        taskId = TaskIds.requireTaskId(taskId);
        if (containerId == null || containerId.isBlank()) {
            throw new IllegalArgumentException("containerId must not be blank");
        }
        if (totalParts < 1 || partIndex < 0 || partIndex >= totalParts) {
            throw new IllegalArgumentException("Invalid part " + partIndex + " of " + totalParts);
        }
        unitIds = TaskIds.requireUnits(unitIds);
    }

    @Override
    public TaskVariant variant() {
        return TaskVariant.SPLIT;
    }
}

package ai.longform.translator.plan;

import java.util.List;

/**
 * Packs whole small containers (or repair units from any container) into one request.
 */
public record BatchTask(String taskId, List<String> unitIds, List<String> containerIds) implements TranslationTask {

    public BatchTask {
        taskId = TaskIds.requireTaskId(taskId);
        unitIds = TaskIds.requireUnits(unitIds);
        containerIds = containerIds == null ? List.of() : List.copyOf(containerIds);
    }

    @Override
    public TaskVariant variant() {
        return TaskVariant.BATCH;
    }
}

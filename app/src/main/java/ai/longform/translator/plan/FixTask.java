package ai.longform.translator.plan;

import java.util.List;
import java.util.Objects;

/**
 * Isolated repair request, normally carrying a single unit.
 */
public record FixTask(String taskId, List<String> unitIds, FixReason reason) implements TranslationTask {

    public FixTask {
        taskId = TaskIds.requireTaskId(taskId);
        unitIds = TaskIds.requireUnits(unitIds);
        reason = Objects.requireNonNull(reason, "reason");
    }

    public static FixTask single(String taskId, String unitId, FixReason reason) {
        return new FixTask(taskId, List.of(unitId), reason);
    }

    @Override
    public TaskVariant variant() {
        return TaskVariant.FIX;
    }
}

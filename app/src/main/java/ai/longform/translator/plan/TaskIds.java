package ai.longform.translator.plan;

import java.util.List;

final class TaskIds {

    private TaskIds() {
    }

    static String requireTaskId(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        return taskId;
    }

    static List<String> requireUnits(List<String> unitIds) {
        if (unitIds == null || unitIds.isEmpty()) {
            throw new IllegalArgumentException("a task must carry at least one unit");
        }
        return List.copyOf(unitIds);
    }
}

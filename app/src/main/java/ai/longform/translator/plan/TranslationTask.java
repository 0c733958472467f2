package ai.longform.translator.plan;

import java.util.List;

/**
 * Unit of work sent to the executor. Callers dispatch on {@link #variant()}.
 */
public sealed interface TranslationTask permits BatchTask, SplitTask, FixTask {

    String taskId();

    /**
     * Ids of the units carried by this task, in payload order.
     */
    List<String> unitIds();

    TaskVariant variant();
}

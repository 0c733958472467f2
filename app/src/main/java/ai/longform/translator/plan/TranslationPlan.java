package ai.longform.translator.plan;

import ai.longform.translator.document.ContentUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of {@link TranslationPlanner}: the ordered tasks plus what reassembly needs to put the
 * results back together.
 *
 * @param splitLayouts container id to per-part unit ids, for containers planned as splits
 * @param syntheticHeadings container id to the planner-inserted heading unit
 * @param units every planned unit by id, synthetic headings included
 * @param containerOfUnit owning container id for every planned unit
 */
public record TranslationPlan(List<TranslationTask> tasks,
                              Map<String, List<List<String>>> splitLayouts,
                              Map<String, ContentUnit> syntheticHeadings,
                              Map<String, ContentUnit> units,
                              Map<String, String> containerOfUnit) {

    public TranslationPlan {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        splitLayouts = freeze(splitLayouts);
        syntheticHeadings = freeze(syntheticHeadings);
        units = freeze(units);
        containerOfUnit = freeze(containerOfUnit);
    }

    public Optional<String> containerOf(String unitId) {
        return Optional.ofNullable(containerOfUnit.get(unitId));
    }

    public boolean isSplit(String containerId) {
        return splitLayouts.containsKey(containerId);
    }

    private static <K, V> Map<K, V> freeze(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

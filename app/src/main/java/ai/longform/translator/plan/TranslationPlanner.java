package ai.longform.translator.plan;

import ai.longform.translator.document.Container;
import ai.longform.translator.document.ContentUnit;
import ai.longform.translator.document.Document;
import ai.longform.translator.exchange.FragmentCodec;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions a document into batch and split tasks whose serialized payloads fit the effective
 * token budget.
 */
public class TranslationPlanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationPlanner.class);
    static final String SYNTHETIC_TITLE_SUFFIX = "::synthetic-title";

    private final TokenEstimator estimator;
    private final FragmentCodec codec;
    private final int budget;

    public TranslationPlanner(TokenEstimator estimator, FragmentCodec codec, TokenBudget budget) {
        this.estimator = Objects.requireNonNull(estimator, "estimator");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.budget = Objects.requireNonNull(budget, "budget").effective();
    }

    public int budget() {
        return budget;
    }

    public TranslationPlan plan(Document document) {
        Objects.requireNonNull(document, "document");
        Set<String> takenIds = new HashSet<>(document.unitsById().keySet());
        Map<String, ContentUnit> units = new LinkedHashMap<>();
        Map<String, String> containerOfUnit = new LinkedHashMap<>();
        Map<String, ContentUnit> syntheticHeadings = new LinkedHashMap<>();
        Map<String, List<List<String>>> splitLayouts = new LinkedHashMap<>();
        List<TranslationTask> tasks = new ArrayList<>();
        BatchAccumulator batches = new BatchAccumulator("batch-", wrapperCost());

        for (Container container : document.containers()) {
            if (container.isEmpty()) {
                LOGGER.info("Skipping empty container {}", container.id());
                continue;
            }
            List<ContentUnit> planned = new ArrayList<>(container.units().size() + 1);
            if (!container.hasHeading() && !container.title().isBlank()) {
                ContentUnit heading = ContentUnit.syntheticHeading(syntheticIdFor(container.id(), takenIds),
                        container.title());
                syntheticHeadings.put(container.id(), heading);
                planned.add(heading);
            }
            planned.addAll(container.units());
            planned.forEach(unit -> {
                units.put(unit.id(), unit);
                containerOfUnit.put(unit.id(), container.id());
            });

            List<Integer> costs = planned.stream().map(this::unitCost).toList();
            int total = costs.stream().mapToInt(Integer::intValue).sum();
            if (total + batches.wrapperCost > budget) {
                batches.flushInto(tasks);
                List<List<String>> parts = splitParts(planned, costs);
                for (int i = 0; i < parts.size(); i++) {
                    tasks.add(new SplitTask(splitTaskId(container.id(), i), container.id(), i, parts.size(),
                            parts.get(i)));
                }
                splitLayouts.put(container.id(), parts);
                LOGGER.debug("Container {} split into {} parts ({} tokens)", container.id(), parts.size(), total);
            } else {
                if (!batches.fits(total)) {
                    batches.flushInto(tasks);
                }
                batches.add(planned, container.id(), total);
            }
        }
        batches.flushInto(tasks);
        LOGGER.info("Planned {} tasks for {} units (budget {} tokens, {} split containers)",
                tasks.size(), units.size(), budget, splitLayouts.size());
        return new TranslationPlan(tasks, splitLayouts, syntheticHeadings, units, containerOfUnit);
    }

    /**
     * Packs arbitrary units, possibly from different containers, into fresh batch tasks for a
     * repair round. Unit order is kept.
     */
    public List<BatchTask> planRepair(Collection<ContentUnit> repairUnits, String taskIdPrefix) {
        Objects.requireNonNull(repairUnits, "repairUnits");
        BatchAccumulator batches = new BatchAccumulator(taskIdPrefix, wrapperCost());
        List<TranslationTask> tasks = new ArrayList<>();
        for (ContentUnit unit : repairUnits) {
            int cost = unitCost(unit);
            if (!batches.fits(cost)) {
                batches.flushInto(tasks);
            }
            batches.add(List.of(unit), null, cost);
        }
        batches.flushInto(tasks);
        return tasks.stream().map(BatchTask.class::cast).toList();
    }

    int unitCost(ContentUnit unit) {
        return estimator.estimate(codec.fragmentLine(unit));
    }

    private int wrapperCost() {
        return estimator.estimate(codec.batchWrapper());
    }

    private List<List<String>> splitParts(List<ContentUnit> planned, List<Integer> costs) {
        List<List<String>> parts = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int running = 0;
        for (int i = 0; i < planned.size(); i++) {
            int cost = costs.get(i);
            if (!current.isEmpty() && running + cost > budget) {
                parts.add(List.copyOf(current));
                current.clear();
                running = 0;
            }
            if (cost > budget) {
                LOGGER.warn("Unit {} alone exceeds the token budget ({} > {})", planned.get(i).id(), cost, budget);
            }
            current.add(planned.get(i).id());
            running += cost;
        }
        if (!current.isEmpty()) {
            parts.add(List.copyOf(current));
        }
        return parts;
    }

    static String splitTaskId(String containerId, int partIndex) {
        return "split-" + containerId + "-part-" + partIndex;
    }

    private static String syntheticIdFor(String containerId, Set<String> takenIds) {
        String candidate = containerId + SYNTHETIC_TITLE_SUFFIX;
        int suffix = 2;
        while (takenIds.contains(candidate)) {
            candidate = containerId + SYNTHETIC_TITLE_SUFFIX + "-" + suffix++;
        }
        takenIds.add(candidate);
        return candidate;
    }

    private final class BatchAccumulator {

        private final String prefix;
        private final int wrapperCost;
        private final List<String> unitIds = new ArrayList<>();
        private final List<String> containerIds = new ArrayList<>();
        private int tokens;
        private int counter;

        private BatchAccumulator(String prefix, int wrapperCost) {
            this.prefix = prefix;
            this.wrapperCost = wrapperCost;
        }

        private boolean fits(int cost) {
            return unitIds.isEmpty() || wrapperCost + tokens + cost <= budget;
        }

        private void add(List<ContentUnit> planned, String containerId, int cost) {
            planned.forEach(unit -> unitIds.add(unit.id()));
            if (containerId != null) {
                containerIds.add(containerId);
            }
            tokens += cost;
        }

        private void flushInto(List<TranslationTask> tasks) {
            if (unitIds.isEmpty()) {
                return;
            }
            tasks.add(new BatchTask(prefix + counter++, unitIds, containerIds));
            unitIds.clear();
            containerIds.clear();
            tokens = 0;
        }
    }
}

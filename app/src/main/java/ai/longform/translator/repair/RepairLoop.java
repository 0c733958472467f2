package ai.longform.translator.repair;

import ai.longform.translator.document.ContentUnit;
import ai.longform.translator.exchange.PromptRenderer;
import ai.longform.translator.plan.FixReason;
import ai.longform.translator.plan.FixTask;
import ai.longform.translator.plan.TranslationPlan;
import ai.longform.translator.plan.TranslationPlanner;
import ai.longform.translator.plan.TranslationTask;
import ai.longform.translator.quality.ErrorClass;
import ai.longform.translator.quality.QualityAssessor;
import ai.longform.translator.quality.QualityReport;
import ai.longform.translator.translate.ResponseLog;
import ai.longform.translator.translate.TranslationExecutor;
import ai.longform.translator.translate.TranslationResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes the plan, then keeps re-issuing failing units for at most {@code maxRounds} rounds
 * in total. Soft errors go back in fresh batches, hard errors and untranslated units get a
 * dedicated fix request each.
 */
public class RepairLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(RepairLoop.class);

    private final TranslationPlanner planner;
    private final TranslationExecutor executor;
    private final QualityAssessor assessor;
    private final int maxRounds;

    public RepairLoop(TranslationPlanner planner, TranslationExecutor executor, QualityAssessor assessor, int maxRounds) {
        this.planner = Objects.requireNonNull(planner, "planner");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.assessor = Objects.requireNonNull(assessor, "assessor");
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1");
        }
        this.maxRounds = maxRounds;
    }

    public RepairOutcome run(TranslationPlan plan, PromptRenderer renderer, ResponseLog responseLog) {
        Map<String, Optional<String>> latest = new LinkedHashMap<>();
        plan.units().keySet().forEach(id -> latest.put(id, Optional.empty()));
        List<TranslationResult> initialResults = List.of();
        List<RoundSummary> rounds = new ArrayList<>();
        List<TranslationTask> tasks = plan.tasks();
        QualityReport report = null;

        for (int round = 0; round < maxRounds && !tasks.isEmpty(); round++) {
            List<TranslationResult> results = executor.execute(tasks, plan.units(), renderer, round, responseLog);
            if (round == 0) {
                initialResults = results;
            }
            List<String> requested = new ArrayList<>();
            for (TranslationResult result : results) {
                result.perUnit().forEach(latest::put);
                requested.addAll(result.task().unitIds());
            }
            report = assessor.assess(requested, plan.units(), latest);
            rounds.add(new RoundSummary(round, tasks.size(), requested.size(), report.softErrors().size(),
                    report.hardErrors().size(), report.missedTranslations().size()));
            if (report.isClean()) {
                LOGGER.info("Round {} resolved all {} requested units", round, requested.size());
                break;
            }
            LOGGER.info("Round {}: {} of {} units failing ({} soft, {} hard, {} missed)", round,
                    report.failingCount(), requested.size(), report.softErrors().size(),
                    report.hardErrors().size(), report.missedTranslations().size());
            tasks = round + 1 < maxRounds ? repairTasks(plan, report, round + 1) : List.of();
        }

        List<UnresolvedUnit> unresolved = report == null ? List.of() : unresolved(plan, report, latest);
        if (!unresolved.isEmpty()) {
            LOGGER.warn("{} units remain unresolved after {} rounds", unresolved.size(), rounds.size());
        }
        return new RepairOutcome(latest, initialResults, unresolved, rounds);
    }

    List<TranslationTask> repairTasks(TranslationPlan plan, QualityReport report, int round) {
        List<TranslationTask> tasks = new ArrayList<>();
        List<ContentUnit> softUnits = report.softErrors().stream().map(plan.units()::get).toList();
        tasks.addAll(planner.planRepair(softUnits, "retry-r" + round + "-"));
        int fixCounter = 0;
        for (String id : report.hardErrors()) {
            tasks.add(FixTask.single("fix-r" + round + "-" + fixCounter++, id, FixReason.HARD_ERROR));
        }
        for (String id : report.missedTranslations()) {
            tasks.add(FixTask.single("fix-r" + round + "-" + fixCounter++, id, FixReason.MISSED_TRANSLATION));
        }
        return tasks;
    }

    private List<UnresolvedUnit> unresolved(TranslationPlan plan, QualityReport report,
                                            Map<String, Optional<String>> latest) {
        List<UnresolvedUnit> unresolved = new ArrayList<>();
        List<String> failing = new ArrayList<>(report.softErrors());
        failing.addAll(report.hardErrors());
        failing.addAll(report.missedTranslations());
        for (String id : failing) {
            ContentUnit unit = plan.units().get(id);
            Optional<String> text = latest.getOrDefault(id, Optional.empty());
            ErrorClass errorClass = assessor.classify(unit, text);
            unresolved.add(new UnresolvedUnit(id, plan.containerOf(id).orElse(""), unit.sourceText(), text,
                    errorClass, report.missedTranslations().contains(id)));
        }
        return unresolved;
    }
}

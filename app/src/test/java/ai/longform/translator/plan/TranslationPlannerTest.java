package ai.longform.translator.plan;

import static org.assertj.core.api.Assertions.assertThat;

import ai.longform.translator.document.Container;
import ai.longform.translator.document.ContentUnit;
import ai.longform.translator.document.Document;
import ai.longform.translator.document.UnitKind;
import ai.longform.translator.exchange.FragmentCodec;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class TranslationPlannerTest {

    /** Counts only the letter x, so fragment markup is free and unit costs are exact. */
    private static final TokenEstimator X_COUNTER = text -> (int) text.chars().filter(ch -> ch == 'x').count();

    private final FragmentCodec codec = new FragmentCodec();

    @Test
    void splitsOversizedContainerIntoOrderedParts() {
        Document document = new Document("Book", List.of(new Container("c1", "", List.of(
                paragraph("u0", 3000), paragraph("u1", 3000), paragraph("u2", 3000)))));

        TranslationPlan plan = new TranslationPlanner(X_COUNTER, codec, TokenBudget.exactly(8000)).plan(document);

        assertThat(plan.tasks()).hasSize(2);
        SplitTask first = (SplitTask) plan.tasks().get(0);
        SplitTask second = (SplitTask) plan.tasks().get(1);
        assertThat(first.unitIds()).containsExactly("u0", "u1");
        assertThat(first.partIndex()).isZero();
        assertThat(first.totalParts()).isEqualTo(2);
        assertThat(first.taskId()).isEqualTo("split-c1-part-0");
        assertThat(second.unitIds()).containsExactly("u2");
        assertThat(second.partIndex()).isEqualTo(1);
        assertThat(plan.splitLayouts().get("c1")).containsExactly(List.of("u0", "u1"), List.of("u2"));
    }

    @Test
    void batchesSmallContainersWithoutSplittingThem() {
        Document document = new Document("Book", List.of(
                new Container("c1", "", List.of(paragraph("a1", 2000), paragraph("a2", 1000))),
                new Container("c2", "", List.of(paragraph("b1", 3000))),
                new Container("c3", "", List.of(paragraph("d1", 3000)))));

        TranslationPlan plan = new TranslationPlanner(X_COUNTER, codec, TokenBudget.exactly(8000)).plan(document);

        assertThat(plan.tasks()).hasSize(2);
        BatchTask first = (BatchTask) plan.tasks().get(0);
        BatchTask second = (BatchTask) plan.tasks().get(1);
        assertThat(first.taskId()).isEqualTo("batch-0");
        assertThat(first.unitIds()).containsExactly("a1", "a2", "b1");
        assertThat(first.containerIds()).containsExactly("c1", "c2");
        assertThat(second.unitIds()).containsExactly("d1");
        assertThat(plan.splitLayouts()).isEmpty();
    }

    @Test
    void oversizedUnitIsAlwaysAlone() {
        Document document = new Document("Book", List.of(new Container("c1", "", List.of(
                paragraph("u0", 100), paragraph("huge", 9000), paragraph("u2", 100)))));

        TranslationPlan plan = new TranslationPlanner(X_COUNTER, codec, TokenBudget.exactly(8000)).plan(document);

        assertThat(plan.tasks()).extracting(TranslationTask::unitIds)
                .containsExactly(List.of("u0"), List.of("huge"), List.of("u2"));
    }

    @Test
    void flushesOpenBatchBeforeSplittingSoTaskOrderFollowsTheDocument() {
        Document document = new Document("Book", List.of(
                new Container("c1", "", List.of(paragraph("a1", 100))),
                new Container("c2", "", List.of(paragraph("b1", 5000), paragraph("b2", 5000))),
                new Container("c3", "", List.of(paragraph("d1", 100)))));

        TranslationPlan plan = new TranslationPlanner(X_COUNTER, codec, TokenBudget.exactly(8000)).plan(document);

        assertThat(plan.tasks()).extracting(TranslationTask::variant)
                .containsExactly(TaskVariant.BATCH, TaskVariant.SPLIT, TaskVariant.SPLIT, TaskVariant.BATCH);
        assertThat(plan.tasks()).flatExtracting(TranslationTask::unitIds)
                .containsExactly("a1", "b1", "b2", "d1");
    }

    @Test
    void everyPayloadFitsTheBudgetUnlessItCarriesASingleUnit() {
        TokenEstimator estimator = new CharacterRatioTokenEstimator();
        List<Container> containers = new ArrayList<>();
        for (int c = 0; c < 25; c++) {
            List<ContentUnit> units = new ArrayList<>();
            for (int u = 0; u < (c % 6) + 1; u++) {
                int words = (c * 137 + u * 61) % 700 + 5;
                units.add(ContentUnit.of("c" + c + "-u" + u, "word ".repeat(words).strip(), UnitKind.PARAGRAPH));
            }
            if (c % 4 == 0) {
                units.add(ContentUnit.of("c" + c + "-big", "long ".repeat(2000).strip(), UnitKind.PARAGRAPH));
            }
            containers.add(new Container("c" + c, "Chapter " + c, units));
        }
        Document document = new Document("Book", containers);
        TranslationPlanner planner = new TranslationPlanner(estimator, codec, TokenBudget.exactly(1500));

        TranslationPlan plan = planner.plan(document);

        for (TranslationTask task : plan.tasks()) {
            List<ContentUnit> units = task.unitIds().stream().map(plan.units()::get).toList();
            int cost = estimator.estimate(codec.serialize(task.variant(), units));
            if (task.unitIds().size() > 1) {
                assertThat(cost).as(task.taskId()).isLessThanOrEqualTo(1500);
            }
        }
        List<String> planned = plan.tasks().stream().flatMap(task -> task.unitIds().stream()).toList();
        assertThat(planned).containsExactlyElementsOf(plan.units().keySet());
    }

    @Test
    void insertsSyntheticHeadingForHeadlessContainer() {
        Document document = new Document("Book", List.of(
                new Container("c1", "Chapter One", List.of(paragraph("u1", 10))),
                new Container("c2", "Chapter Two", List.of(
                        ContentUnit.of("h2", "Chapter Two", UnitKind.HEADING), paragraph("u2", 10)))));

        TranslationPlan plan = new TranslationPlanner(X_COUNTER, codec, TokenBudget.exactly(8000)).plan(document);

        ContentUnit synthetic = plan.syntheticHeadings().get("c1");
        assertThat(synthetic.id()).isEqualTo("c1::synthetic-title");
        assertThat(synthetic.synthetic()).isTrue();
        assertThat(synthetic.sourceText()).isEqualTo("Chapter One");
        assertThat(plan.syntheticHeadings()).doesNotContainKey("c2");
        assertThat(plan.tasks().get(0).unitIds()).containsExactly("c1::synthetic-title", "u1", "h2", "u2");
        assertThat(plan.containerOf("c1::synthetic-title")).contains("c1");
    }

    @Test
    void syntheticHeadingIdAvoidsExistingIds() {
        Document document = new Document("Book", List.of(
                new Container("c0", "", List.of(paragraph("c1::synthetic-title", 10))),
                new Container("c1", "Chapter One", List.of(paragraph("u1", 10)))));

        TranslationPlan plan = new TranslationPlanner(X_COUNTER, codec, TokenBudget.exactly(8000)).plan(document);

        assertThat(plan.syntheticHeadings().get("c1").id()).isEqualTo("c1::synthetic-title-2");
    }

    @Test
    void omitsEmptyContainers() {
        Document document = new Document("Book", List.of(
                new Container("empty", "Cover", List.of()),
                new Container("c1", "", List.of(paragraph("u1", 10)))));

        TranslationPlan plan = new TranslationPlanner(X_COUNTER, codec, TokenBudget.exactly(8000)).plan(document);

        assertThat(plan.tasks()).hasSize(1);
        assertThat(plan.units()).containsOnlyKeys("u1");
    }

    @Test
    void repairBatchesMixContainers() {
        TranslationPlanner planner = new TranslationPlanner(X_COUNTER, codec, TokenBudget.exactly(8000));
        List<ContentUnit> failing = List.of(paragraph("a1", 3000), paragraph("b7", 3000), paragraph("d2", 3000));

        List<BatchTask> tasks = planner.planRepair(failing, "retry-r1-");

        assertThat(tasks).extracting(BatchTask::taskId).containsExactly("retry-r1-0", "retry-r1-1");
        assertThat(tasks.get(0).unitIds()).containsExactly("a1", "b7");
        assertThat(tasks.get(1).unitIds()).containsExactly("d2");
    }

    @Test
    void planIsDeterministic() {
        Document document = new Document("Book", List.of(
                new Container("c1", "One", List.of(paragraph("a1", 4000), paragraph("a2", 4000), paragraph("a3", 10))),
                new Container("c2", "Two", List.of(paragraph("b1", 10)))));
        TranslationPlanner planner = new TranslationPlanner(X_COUNTER, codec, TokenBudget.exactly(8000));

        String first = describe(planner.plan(document));
        String second = describe(planner.plan(document));

        assertThat(first).isEqualTo(second);
    }

    private static String describe(TranslationPlan plan) {
        return plan.tasks().stream()
                .map(task -> task.taskId() + task.unitIds())
                .collect(Collectors.joining(";"));
    }

    private static ContentUnit paragraph(String id, int size) {
        return ContentUnit.of(id, "x".repeat(size), UnitKind.PARAGRAPH);
    }
}

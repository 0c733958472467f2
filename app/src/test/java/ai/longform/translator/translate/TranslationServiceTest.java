package ai.longform.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.longform.translator.config.EngineSettings;
import ai.longform.translator.document.Container;
import ai.longform.translator.document.ContentUnit;
import ai.longform.translator.document.Document;
import ai.longform.translator.document.NavigationEntry;
import ai.longform.translator.document.UnitKind;
import ai.longform.translator.exchange.PromptTemplates;
import ai.longform.translator.plan.TokenEstimator;
import ai.longform.translator.quality.ErrorClass;
import ai.longform.translator.repair.UnresolvedUnitPolicy;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.Test;

class TranslationServiceTest {

    private static final TokenEstimator X_COUNTER = text -> (int) text.chars().filter(ch -> ch == 'x').count();
    private static final PromptTemplates ECHO_TEMPLATES = new PromptTemplates("{{payload}}", "{{payload}}", "{{payload}}");

    @Test
    void translatesSplitAndBatchedContainersIntoOneDocument() {
        TranslationService service = new TranslationService(settings(UnresolvedUnitPolicy.FALL_BACK_TO_SOURCE),
                TranslationExecutorTest::translated, ECHO_TEMPLATES, X_COUNTER);

        EngineResult result = service.translate(book(), TranslationRequest.to("zh"));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.plannedTasks()).isEqualTo(3);
        assertThat(result.rounds()).hasSize(1);
        assertThat(result.responseLog().size()).isEqualTo(3);
        Document translated = result.document();
        assertThat(translated.targetLanguage()).contains("zh");
        assertThat(translated.containers()).extracting(Container::id).containsExactly("c1", "c2");
        Container longChapter = translated.containers().get(0);
        assertThat(longChapter.units()).extracting(ContentUnit::id).containsExactly("u0", "u1", "u2");
        assertThat(longChapter.units()).allSatisfy(unit ->
                assertThat(unit.targetText()).hasValueSatisfying(text -> assertThat(text).startsWith("T:x")));
        assertThat(longChapter.derivedTitle()).contains("T:Chapter One");
        assertThat(translated.containers().get(1).derivedTitle()).contains("T:Short");
        assertThat(translated.navigation()).extracting(NavigationEntry::label)
                .containsExactly("1. T:Chapter One", "T:Short");
    }

    @Test
    void repairsUnitLeftEmptyByTheFirstResponse() {
        Set<String> failedOnce = ConcurrentHashMap.newKeySet();
        CompletionClient client = prompt -> {
            String response = TranslationExecutorTest.translated(prompt);
            if (prompt.contains("id=\"b2\"") && failedOnce.add("b2")) {
                return response.replaceAll("(<seg id=\"b2\"[^>]*>)[^<]*", "$1");
            }
            return response;
        };
        TranslationService service = new TranslationService(settings(UnresolvedUnitPolicy.FALL_BACK_TO_SOURCE),
                client, ECHO_TEMPLATES, X_COUNTER);

        EngineResult result = service.translate(book(), TranslationRequest.to("zh"));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.rounds()).hasSize(2);
        assertThat(result.rounds().get(0).softErrors()).isEqualTo(1);
        assertThat(result.rounds().get(1).requestedUnits()).isEqualTo(1);
        assertThat(result.responseLog().entries()).extracting(ResponseLogEntry::taskId).contains("retry-r1-0");
        assertThat(result.document().unitsById().get("b2").targetText()).contains("T:Body");
        assertThat(result.document().unitsById().get("b1").targetText()).contains("T:Short");
    }

    @Test
    void reportsUnitsThatStayUntranslatedAndFallsBackToSource() {
        TranslationService service = new TranslationService(settings(UnresolvedUnitPolicy.FALL_BACK_TO_SOURCE),
                new PassThroughCompletionClient(), ECHO_TEMPLATES, X_COUNTER);
        Document document = new Document("Book", List.of(new Container("c1", "", List.of(
                ContentUnit.of("p1", "Hello world", UnitKind.PARAGRAPH)))));

        EngineResult result = service.translate(document, TranslationRequest.to("zh"));

        assertThat(result.isComplete()).isFalse();
        assertThat(result.rounds()).hasSize(3);
        assertThat(result.unresolved()).singleElement().satisfies(unit -> {
            assertThat(unit.unitId()).isEqualTo("p1");
            assertThat(unit.missedTranslation()).isTrue();
            assertThat(unit.errorClass()).isEqualTo(ErrorClass.SUCCESS);
        });
        assertThat(result.document().unitsById().get("p1").targetText()).contains("Hello world");
    }

    @Test
    void sourceDocumentIsLeftUntouched() {
        Document original = book();
        TranslationService service = new TranslationService(settings(UnresolvedUnitPolicy.LEAVE_EMPTY),
                TranslationExecutorTest::translated, ECHO_TEMPLATES, X_COUNTER);

        service.translate(original, TranslationRequest.to("zh"));

        assertThat(original.unitsById().values()).allSatisfy(unit -> assertThat(unit.targetText()).isEmpty());
        assertThat(original.navigation()).extracting(NavigationEntry::label).containsExactly("1. Chapter One", "Short");
    }

    private static EngineSettings settings(UnresolvedUnitPolicy policy) {
        return new EngineSettings(8000, 1.0, 1.0, 2, 3, Duration.ofSeconds(5), 1,
                Duration.ZERO, Duration.ZERO, 0.0, policy, true);
    }

    private static Document book() {
        Container longChapter = new Container("c1", "Chapter One", List.of(
                ContentUnit.of("u0", "x".repeat(3000), UnitKind.PARAGRAPH),
                ContentUnit.of("u1", "x".repeat(3000), UnitKind.PARAGRAPH),
                ContentUnit.of("u2", "x".repeat(3000), UnitKind.PARAGRAPH)));
        Container shortChapter = new Container("c2", "Short", List.of(
                ContentUnit.of("b1", "Short", UnitKind.HEADING),
                ContentUnit.of("b2", "Body", UnitKind.PARAGRAPH)));
        return new Document("Book", Optional.of("en"), Optional.empty(), List.of(longChapter, shortChapter),
                List.of(new NavigationEntry("c1", "1. Chapter One"), new NavigationEntry("c2", "Short")));
    }
}

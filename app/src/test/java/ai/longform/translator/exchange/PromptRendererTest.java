package ai.longform.translator.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.longform.translator.document.ContentUnit;
import ai.longform.translator.document.UnitKind;
import ai.longform.translator.plan.BatchTask;
import ai.longform.translator.plan.FixReason;
import ai.longform.translator.plan.FixTask;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PromptRendererTest {

    private static final Map<String, ContentUnit> UNITS = Map.of(
            "p1", ContentUnit.of("p1", "Hello", UnitKind.PARAGRAPH),
            "p2", ContentUnit.of("p2", "World", UnitKind.PARAGRAPH));

    @Test
    void interpolatesPayloadAndContext() {
        PromptTemplates templates = new PromptTemplates(
                "{{source_language}}>{{target_language}} [{{title}}] {{glossary}}\n{{payload}}",
                "split {{payload}}",
                "fix {{payload}} {{unknown}}");
        PromptRenderer renderer = new PromptRenderer(templates, new FragmentCodec(), "en", "zh-CN", "Moby Dick",
                new Glossary(Map.of("whale", "鲸")));

        String prompt = renderer.render(new BatchTask("batch-0", List.of("p1", "p2"), List.of("c1")), UNITS);

        assertThat(prompt).startsWith("en>zh-CN [Moby Dick] - whale => 鲸\n<segments>\n");
        assertThat(prompt).contains("<seg id=\"p2\" kind=\"paragraph\">World</seg>");
    }

    @Test
    void leavesUnknownPlaceholdersAndUsesFixTemplate() {
        PromptTemplates templates = new PromptTemplates("{{payload}}", "{{payload}}", "fix {{payload}} {{unknown}}");
        PromptRenderer renderer = new PromptRenderer(templates, new FragmentCodec(), null, "ja", null, null);

        String prompt = renderer.render(FixTask.single("fix-r1-0", "p1", FixReason.HARD_ERROR), UNITS);

        assertThat(prompt).isEqualTo("fix <seg id=\"p1\" kind=\"paragraph\">Hello</seg> {{unknown}}");
    }

    @Test
    void fixPromptStatesWhyTheUnitIsRetried() {
        PromptTemplates templates = new PromptTemplates("{{reason}} {{payload}}", "{{payload}}", "{{reason}}");
        PromptRenderer renderer = new PromptRenderer(templates, new FragmentCodec(), "en", "ja", "T", Glossary.empty());

        String hard = renderer.render(FixTask.single("fix-r1-0", "p1", FixReason.HARD_ERROR), UNITS);
        String missed = renderer.render(FixTask.single("fix-r1-1", "p1", FixReason.MISSED_TRANSLATION), UNITS);
        String batch = renderer.render(new BatchTask("batch-0", List.of("p1"), List.of()), UNITS);

        assertThat(hard).contains("garbled");
        assertThat(missed).isEqualTo("it was left untranslated");
        assertThat(batch).startsWith("{{reason}} <segments>");
    }

    @Test
    void payloadIsNotReinterpolated() {
        PromptTemplates templates = new PromptTemplates("{{payload}}", "{{payload}}", "{{payload}}");
        PromptRenderer renderer = new PromptRenderer(templates, new FragmentCodec(), "en", "ja", "T", Glossary.empty());
        Map<String, ContentUnit> units = Map.of("p1", ContentUnit.of("p1", "Use {{title}} $1 here", UnitKind.PARAGRAPH));

        String prompt = renderer.render(FixTask.single("fix-r1-0", "p1", FixReason.HARD_ERROR), units);

        assertThat(prompt).contains("Use {{title}} $1 here");
    }

    @Test
    void rejectsTaskWithUnknownUnit() {
        PromptRenderer renderer = new PromptRenderer(PromptTemplates.loadDefaults(), new FragmentCodec(), "en", "ja",
                "T", Glossary.empty());

        assertThatThrownBy(() -> renderer.render(FixTask.single("fix-r1-0", "missing", FixReason.HARD_ERROR), UNITS))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultTemplatesCarryAllPlaceholders() {
        PromptTemplates templates = PromptTemplates.loadDefaults();

        for (String template : List.of(templates.batch(), templates.split(), templates.fix())) {
            assertThat(template).contains("{{payload}}", "{{target_language}}", "{{glossary}}");
        }
        assertThat(templates.fix()).contains("{{reason}}");
    }

    @Test
    void emptyGlossaryRendersPlaceholderText() {
        assertThat(Glossary.empty().render()).isEqualTo("(none)");
    }
}

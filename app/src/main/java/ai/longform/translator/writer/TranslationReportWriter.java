package ai.longform.translator.writer;

import ai.longform.translator.repair.RoundSummary;
import ai.longform.translator.repair.UnresolvedUnit;
import ai.longform.translator.translate.EngineResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Writes the round statistics and the units that could not be resolved.
 */
public class TranslationReportWriter {

    private final ObjectMapper mapper = JsonSupport.prettyMapper();

    public void write(Path target, EngineResult result) {
        if (target == null || result == null) {
            throw new IllegalArgumentException("target and result must be provided");
        }
        ObjectNode report = mapper.createObjectNode();
        report.put("title", result.document().title());
        result.document().targetLanguage().ifPresent(language -> report.put("targetLanguage", language));
        report.put("plannedTasks", result.plannedTasks());
        report.put("responses", result.responseLog().size());
        ArrayNode rounds = report.putArray("rounds");
        for (RoundSummary round : result.rounds()) {
            rounds.add(mapper.valueToTree(round));
        }
        ArrayNode unresolved = report.putArray("unresolved");
        for (UnresolvedUnit unit : result.unresolved()) {
            ObjectNode node = unresolved.addObject();
            node.put("unitId", unit.unitId());
            node.put("containerId", unit.containerId());
            node.put("errorClass", unit.errorClass().name());
            node.put("missedTranslation", unit.missedTranslation());
            node.put("sourceText", unit.sourceText());
            unit.lastText().ifPresent(text -> node.put("lastText", text));
        }
        try {
            DocumentWriter.createParent(target);
            mapper.writeValue(target.toFile(), report);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write translation report: " + target, ex);
        }
    }
}

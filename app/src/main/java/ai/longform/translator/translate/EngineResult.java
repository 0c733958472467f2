package ai.longform.translator.translate;

import ai.longform.translator.document.Document;
import ai.longform.translator.repair.RoundSummary;
import ai.longform.translator.repair.UnresolvedUnit;
import java.util.List;
import java.util.Objects;

/**
 * Everything a translation run produces.
 */
public record EngineResult(Document document,
                           ResponseLog responseLog,
                           List<UnresolvedUnit> unresolved,
                           List<RoundSummary> rounds,
                           int plannedTasks) {

    public EngineResult {
        document = Objects.requireNonNull(document, "document");
        responseLog = Objects.requireNonNull(responseLog, "responseLog");
        unresolved = List.copyOf(unresolved);
        rounds = List.copyOf(rounds);
    }

    public boolean isComplete() {
        return unresolved.isEmpty();
    }
}

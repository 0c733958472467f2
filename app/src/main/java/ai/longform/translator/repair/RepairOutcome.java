package ai.longform.translator.repair;

import ai.longform.translator.translate.TranslationResult;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Final state of the repair loop.
 *
 * @param translations latest text for every planned unit
 * @param initialResults round 0 results, which carry the split parts
 */
public record RepairOutcome(Map<String, Optional<String>> translations,
                            List<TranslationResult> initialResults,
                            List<UnresolvedUnit> unresolved,
                            List<RoundSummary> rounds) {

    public RepairOutcome {
        translations = Collections.unmodifiableMap(new LinkedHashMap<>(translations));
        initialResults = List.copyOf(initialResults);
        unresolved = List.copyOf(unresolved);
        rounds = List.copyOf(rounds);
    }

    public Set<String> unresolvedIds() {
        return unresolved.stream().map(UnresolvedUnit::unitId).collect(Collectors.toUnmodifiableSet());
    }
}

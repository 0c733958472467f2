package ai.longform.translator.assemble;

import ai.longform.translator.document.Container;
import ai.longform.translator.document.ContentUnit;
import ai.longform.translator.document.Document;
import ai.longform.translator.document.NavigationEntry;
import ai.longform.translator.plan.SplitTask;
import ai.longform.translator.plan.TranslationPlan;
import ai.longform.translator.repair.RepairOutcome;
import ai.longform.translator.repair.UnresolvedUnitPolicy;
import ai.longform.translator.translate.TranslationResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the translated document from the original and the final per-unit texts. The original
 * document is never modified.
 */
public class Reassembler {

    private final NavigationPatcher navigationPatcher;
    private final UnresolvedUnitPolicy unresolvedPolicy;

    public Reassembler(NavigationPatcher navigationPatcher, UnresolvedUnitPolicy unresolvedPolicy) {
        this.navigationPatcher = Objects.requireNonNull(navigationPatcher, "navigationPatcher");
        this.unresolvedPolicy = Objects.requireNonNull(unresolvedPolicy, "unresolvedPolicy");
    }

    public Document reassemble(Document original, TranslationPlan plan, RepairOutcome outcome, String targetLanguage) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(outcome, "outcome");
        Map<String, List<SplitTask>> partsByContainer = splitParts(outcome.initialResults());
        Set<String> unresolved = outcome.unresolvedIds();

        List<Container> containers = new ArrayList<>(original.containers().size());
        Map<String, String> derivedTitles = new HashMap<>();
        for (Container container : original.containers()) {
            if (plan.isSplit(container.id())) {
                verifySplit(container, plan, partsByContainer.getOrDefault(container.id(), List.of()));
            }
            List<ContentUnit> units = new ArrayList<>(container.units().size());
            for (ContentUnit unit : container.units()) {
                Optional<String> text = resolve(unit, outcome.translations(), unresolved);
                units.add(unit.withTargetText(text.orElse(null)));
            }
            String derivedTitle = deriveTitle(container, plan, units, outcome.translations(), unresolved);
            derivedTitles.put(container.id(), derivedTitle);
            containers.add(container.withTranslation(units, derivedTitle));
        }
        List<NavigationEntry> navigation = navigationPatcher.patch(original.navigation(), derivedTitles);
        return original.withTranslatedContent(containers, navigation, targetLanguage);
    }

    private Optional<String> resolve(ContentUnit unit, Map<String, Optional<String>> translations, Set<String> unresolved) {
        Optional<String> latest = translations.getOrDefault(unit.id(), Optional.empty());
        if (!unresolved.contains(unit.id())) {
            return latest;
        }
        return switch (unresolvedPolicy) {
            case KEEP_LAST_TEXT -> latest;
            case FALL_BACK_TO_SOURCE -> Optional.of(unit.sourceText());
            case LEAVE_EMPTY -> Optional.empty();
        };
    }

    private String deriveTitle(Container container, TranslationPlan plan, List<ContentUnit> units,
                               Map<String, Optional<String>> translations, Set<String> unresolved) {
        ContentUnit synthetic = plan.syntheticHeadings().get(container.id());
        if (synthetic != null) {
            return resolve(synthetic, translations, unresolved)
                    .filter(title -> !title.isBlank())
                    .orElse(container.title());
        }
        return units.stream()
                .filter(ContentUnit::isHeading)
                .findFirst()
                .flatMap(ContentUnit::targetText)
                .filter(title -> !title.isBlank())
                .orElse(container.title());
    }

    private void verifySplit(Container container, TranslationPlan plan, List<SplitTask> parts) {
        List<List<String>> layout = plan.splitLayouts().get(container.id());
        int totalParts = layout.size();
        Map<Integer, SplitTask> byIndex = new LinkedHashMap<>();
        for (SplitTask part : parts) {
            byIndex.put(part.partIndex(), part);
            totalParts = part.totalParts();
        }
        List<String> concatenated = new ArrayList<>();
        for (int index = 0; index < totalParts; index++) {
            SplitTask part = byIndex.get(index);
            if (part == null) {
                throw new ReassemblyException("Container " + container.id() + " is missing part " + index
                        + " of " + totalParts);
            }
            concatenated.addAll(part.unitIds());
        }
        ContentUnit synthetic = plan.syntheticHeadings().get(container.id());
        if (synthetic != null) {
            concatenated.remove(synthetic.id());
        }
        List<String> expected = container.units().stream().map(ContentUnit::id).toList();
        if (!concatenated.equals(expected)) {
            throw new ReassemblyException("Split parts of container " + container.id()
                    + " do not reproduce its unit order");
        }
    }

    private static Map<String, List<SplitTask>> splitParts(List<TranslationResult> results) {
        Map<String, List<SplitTask>> parts = new HashMap<>();
        results.stream()
                .map(TranslationResult::task)
                .filter(SplitTask.class::isInstance)
                .map(SplitTask.class::cast)
                .sorted(Comparator.comparingInt(SplitTask::partIndex))
                .forEach(task -> parts.computeIfAbsent(task.containerId(), id -> new ArrayList<>()).add(task));
        return parts;
    }
}

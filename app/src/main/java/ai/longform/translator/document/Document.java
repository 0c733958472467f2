package ai.longform.translator.document;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable document value: ordered containers of ordered units plus navigation entries.
 */
public record Document(String title,
                       Optional<String> sourceLanguage,
                       Optional<String> targetLanguage,
                       List<Container> containers,
                       List<NavigationEntry> navigation) {

    public Document {
        title = title == null ? "" : title;
        sourceLanguage = sourceLanguage == null ? Optional.empty() : sourceLanguage;
        targetLanguage = targetLanguage == null ? Optional.empty() : targetLanguage;
        containers = List.copyOf(Objects.requireNonNull(containers, "containers"));
        navigation = navigation == null ? List.of() : List.copyOf(navigation);
        Set<String> containerIds = new HashSet<>();
        Set<String> unitIds = new HashSet<>();
        for (Container container : containers) {
            if (!containerIds.add(container.id())) {
                throw new IllegalArgumentException("Duplicate container id: " + container.id());
            }
            for (ContentUnit unit : container.units()) {
                if (!unitIds.add(unit.id())) {
                    throw new IllegalArgumentException("Duplicate unit id: " + unit.id());
                }
            }
        }
    }

    public Document(String title, List<Container> containers) {
        this(title, Optional.empty(), Optional.empty(), containers, List.of());
    }

    public Optional<Container> container(String containerId) {
        return containers.stream().filter(c -> c.id().equals(containerId)).findFirst();
    }

    /**
     * Returns every unit keyed by id in document order.
     */
    public Map<String, ContentUnit> unitsById() {
        Map<String, ContentUnit> units = new LinkedHashMap<>();
        for (Container container : containers) {
            for (ContentUnit unit : container.units()) {
                units.put(unit.id(), unit);
            }
        }
        return units;
    }

    public int unitCount() {
        return containers.stream().mapToInt(c -> c.units().size()).sum();
    }

    public Document withTranslatedContent(List<Container> translatedContainers,
                                          List<NavigationEntry> patchedNavigation,
                                          String language) {
        return new Document(title, sourceLanguage, Optional.ofNullable(language).or(() -> targetLanguage),
                translatedContainers, patchedNavigation);
    }
}

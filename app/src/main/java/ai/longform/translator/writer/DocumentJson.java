package ai.longform.translator.writer;

import ai.longform.translator.document.Container;
import ai.longform.translator.document.ContentUnit;
import ai.longform.translator.document.Document;
import ai.longform.translator.document.NavigationEntry;
import ai.longform.translator.document.UnitKind;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Wire shape of a document. Times are carried as milliseconds.
 */
record DocumentJson(String title,
                    String sourceLanguage,
                    String targetLanguage,
                    List<ContainerJson> containers,
                    List<NavigationJson> navigation) {

    record ContainerJson(String id, String title, String epubType, String derivedTitle, List<UnitJson> units) {
    }

    record UnitJson(String id, String kind, String sourceText, Long startMillis, Long endMillis, String targetText) {
    }

    record NavigationJson(String containerId, String label) {
    }

    static DocumentJson from(Document document) {
        return new DocumentJson(document.title(),
                document.sourceLanguage().orElse(null),
                document.targetLanguage().orElse(null),
                document.containers().stream().map(DocumentJson::container).toList(),
                document.navigation().stream().map(entry -> new NavigationJson(entry.containerId(), entry.label())).toList());
    }

    Document toDocument() {
        List<Container> modelContainers = containers == null ? List.of()
                : containers.stream().map(DocumentJson::toContainer).toList();
        List<NavigationEntry> modelNavigation = navigation == null ? List.of()
                : navigation.stream().map(entry -> new NavigationEntry(entry.containerId(), entry.label())).toList();
        return new Document(title == null ? "" : title, Optional.ofNullable(sourceLanguage),
                Optional.ofNullable(targetLanguage), modelContainers, modelNavigation);
    }

    private static ContainerJson container(Container container) {
        return new ContainerJson(container.id(), container.title(), container.epubType().orElse(null),
                container.derivedTitle().orElse(null),
                container.units().stream().map(DocumentJson::unit).toList());
    }

    private static UnitJson unit(ContentUnit unit) {
        return new UnitJson(unit.id(), unit.kind().wireName(), unit.sourceText(),
                unit.startTime().map(Duration::toMillis).orElse(null),
                unit.endTime().map(Duration::toMillis).orElse(null),
                unit.targetText().orElse(null));
    }

    private static Container toContainer(ContainerJson json) {
        List<ContentUnit> units = json.units() == null ? List.of()
                : json.units().stream().map(DocumentJson::toUnit).toList();
        return new Container(json.id(), json.title(), Optional.ofNullable(json.epubType()), units,
                Optional.ofNullable(json.derivedTitle()));
    }

    private static ContentUnit toUnit(UnitJson json) {
        return new ContentUnit(json.id(), json.sourceText() == null ? "" : json.sourceText(), UnitKind.from(json.kind()),
                Optional.ofNullable(json.startMillis()).map(Duration::ofMillis),
                Optional.ofNullable(json.endMillis()).map(Duration::ofMillis),
                Optional.ofNullable(json.targetText()), false);
    }
}

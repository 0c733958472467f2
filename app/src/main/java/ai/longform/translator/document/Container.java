package ai.longform.translator.document;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered group of units: a chapter of a book or a whole subtitle track.
 */
public record Container(String id,
                        String title,
                        Optional<String> epubType,
                        List<ContentUnit> units,
                        Optional<String> derivedTitle) {

    public Container {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        title = title == null ? "" : title;
        epubType = epubType == null ? Optional.empty() : epubType;
        units = List.copyOf(Objects.requireNonNull(units, "units"));
        derivedTitle = derivedTitle == null ? Optional.empty() : derivedTitle;
    }

    public Container(String id, String title, List<ContentUnit> units) {
        this(id, title, Optional.empty(), units, Optional.empty());
    }

    public boolean hasHeading() {
        return units.stream().anyMatch(ContentUnit::isHeading);
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    public Container withTranslation(List<ContentUnit> translatedUnits, String translatedTitle) {
        return new Container(id, title, epubType, translatedUnits, Optional.ofNullable(translatedTitle));
    }
}

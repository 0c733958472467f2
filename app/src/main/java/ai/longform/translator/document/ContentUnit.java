package ai.longform.translator.document;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Smallest independently translatable piece of a document.
 *
 * <p>The id is assigned upstream and never changes; only {@code targetText} may differ between
 * the source document and the translated one.
 */
public record ContentUnit(String id,
                          String sourceText,
                          UnitKind kind,
                          Optional<Duration> startTime,
                          Optional<Duration> endTime,
                          Optional<String> targetText,
                          boolean synthetic) {

    public ContentUnit {
        id = requireNonBlank(id, "id");
        sourceText = Objects.requireNonNull(sourceText, "sourceText");
        kind = Objects.requireNonNull(kind, "kind");
        startTime = startTime == null ? Optional.empty() : startTime;
        endTime = endTime == null ? Optional.empty() : endTime;
        targetText = targetText == null ? Optional.empty() : targetText;
        if (kind != UnitKind.TIMED_SEGMENT && (startTime.isPresent() || endTime.isPresent())) {
            throw new IllegalArgumentException("Only timed segments carry timing: " + id);
        }
        if (startTime.isPresent() && endTime.isPresent() && endTime.get().compareTo(startTime.get()) < 0) {
            throw new IllegalArgumentException("endTime precedes startTime for unit " + id);
        }
    }

    public static ContentUnit of(String id, String sourceText, UnitKind kind) {
        return new ContentUnit(id, sourceText, kind, Optional.empty(), Optional.empty(), Optional.empty(), false);
    }

    public static ContentUnit timed(String id, String sourceText, Duration start, Duration end) {
        return new ContentUnit(id, sourceText, UnitKind.TIMED_SEGMENT,
                Optional.of(start), Optional.of(end), Optional.empty(), false);
    }

    public static ContentUnit syntheticHeading(String id, String title) {
        return new ContentUnit(id, title, UnitKind.HEADING, Optional.empty(), Optional.empty(), Optional.empty(), true);
    }

    public ContentUnit withTargetText(String translated) {
        return new ContentUnit(id, sourceText, kind, startTime, endTime, Optional.ofNullable(translated), synthetic);
    }

    public boolean isHeading() {
        return kind == UnitKind.HEADING;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}

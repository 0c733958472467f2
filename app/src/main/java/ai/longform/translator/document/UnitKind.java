package ai.longform.translator.document;

import java.util.Locale;

/**
 * Structural role of a {@link ContentUnit} inside its container.
 */
public enum UnitKind {
    PARAGRAPH,
    HEADING,
    LIST_ITEM,
    CAPTION,
    TIMED_SEGMENT;

    public static UnitKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PARAGRAPH;
        }
        String normalized = raw.trim().replace('-', '_');
        for (UnitKind kind : values()) {
            if (kind.name().equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported unit kind: " + raw);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}

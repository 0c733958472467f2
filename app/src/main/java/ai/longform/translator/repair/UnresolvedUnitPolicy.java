package ai.longform.translator.repair;

import java.util.Locale;

/**
 * What the translated document carries for a unit that is still failing after the last round.
 */
public enum UnresolvedUnitPolicy {
    /** Keep the latest text, even if it is empty or a failure marker. */
    KEEP_LAST_TEXT,
    FALL_BACK_TO_SOURCE,
    LEAVE_EMPTY;

    public static UnresolvedUnitPolicy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return FALL_BACK_TO_SOURCE;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (UnresolvedUnitPolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unsupported unresolved unit policy: " + raw);
    }
}

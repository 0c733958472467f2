package ai.longform.translator.quality;

/**
 * Quality verdict for the latest translation of a unit. Recomputed every round.
 */
public enum ErrorClass {
    SUCCESS,
    /** Missing, empty or failed translation; retried in a fresh batch. */
    SOFT_ERROR,
    /** Corrupted or refused translation; retried in isolation. */
    HARD_ERROR
}

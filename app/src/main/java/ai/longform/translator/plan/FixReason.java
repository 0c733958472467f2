package ai.longform.translator.plan;

public enum FixReason {
    HARD_ERROR,
    MISSED_TRANSLATION
}

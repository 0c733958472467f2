package ai.longform.translator.plan;

/**
 * Discriminator of the {@link TranslationTask} union.
 */
public enum TaskVariant {
    BATCH,
    SPLIT,
    FIX
}

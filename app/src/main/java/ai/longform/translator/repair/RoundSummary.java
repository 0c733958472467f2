package ai.longform.translator.repair;

public record RoundSummary(int round,
                           int taskCount,
                           int requestedUnits,
                           int softErrors,
                           int hardErrors,
                           int missedTranslations) {
}

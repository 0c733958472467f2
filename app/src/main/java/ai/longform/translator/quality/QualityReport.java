package ai.longform.translator.quality;

import java.util.List;

/**
 * Unit ids of one round grouped by verdict, each list in request order.
 */
public record QualityReport(List<String> succeeded,
                            List<String> softErrors,
                            List<String> hardErrors,
                            List<String> missedTranslations) {

    public QualityReport {
        succeeded = List.copyOf(succeeded);
        softErrors = List.copyOf(softErrors);
        hardErrors = List.copyOf(hardErrors);
        missedTranslations = List.copyOf(missedTranslations);
    }

    public boolean isClean() {
        return softErrors.isEmpty() && hardErrors.isEmpty() && missedTranslations.isEmpty();
    }

    public int failingCount() {
        return softErrors.size() + hardErrors.size() + missedTranslations.size();
    }
}

package ai.longform.translator.quality;

import ai.longform.translator.document.ContentUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies the {@link QualityClassifier} to every unit requested in a round.
 */
public class QualityAssessor {

    private final QualityClassifier classifier;
    private final boolean missedTranslationCheck;

    public QualityAssessor(QualityClassifier classifier, boolean missedTranslationCheck) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.missedTranslationCheck = missedTranslationCheck;
    }

    public QualityReport assess(Collection<String> requestedIds,
                                Map<String, ContentUnit> units,
                                Map<String, Optional<String>> latest) {
        List<String> succeeded = new ArrayList<>();
        List<String> soft = new ArrayList<>();
        List<String> hard = new ArrayList<>();
        List<String> missed = new ArrayList<>();
        for (String id : requestedIds) {
            String source = units.get(id).sourceText();
            Optional<String> text = latest.getOrDefault(id, Optional.empty());
            switch (classifier.classify(source, text)) {
                case SOFT_ERROR -> soft.add(id);
                case HARD_ERROR -> hard.add(id);
                case SUCCESS -> {
                    if (missedTranslationCheck && classifier.isMissedTranslation(source, text)) {
                        missed.add(id);
                    } else {
                        succeeded.add(id);
                    }
                }
            }
        }
        return new QualityReport(succeeded, soft, hard, missed);
    }

    public ErrorClass classify(ContentUnit unit, Optional<String> text) {
        return classifier.classify(unit.sourceText(), text);
    }
}

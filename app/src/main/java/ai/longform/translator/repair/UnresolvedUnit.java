package ai.longform.translator.repair;

import ai.longform.translator.quality.ErrorClass;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit still failing once the repair rounds are exhausted.
 *
 * @param errorClass last verdict; {@link ErrorClass#SUCCESS} when only the missed-translation
 *                   check failed
 */
public record UnresolvedUnit(String unitId,
                             String containerId,
                             String sourceText,
                             Optional<String> lastText,
                             ErrorClass errorClass,
                             boolean missedTranslation) {

    public UnresolvedUnit {
        unitId = Objects.requireNonNull(unitId, "unitId");
        containerId = Objects.requireNonNull(containerId, "containerId");
        sourceText = Objects.requireNonNull(sourceText, "sourceText");
        lastText = lastText == null ? Optional.empty() : lastText;
        errorClass = Objects.requireNonNull(errorClass, "errorClass");
    }
}

package ai.longform.translator.quality;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural checks on a single translated unit. Deterministic and free of side effects.
 */
public class QualityClassifier {

    public static final String FAILURE_SENTINEL = "[TRANSLATION_FAILED]";

    private static final List<Pattern> REPETITION_RULES = List.of(
            Pattern.compile("(\\S)\\1{4,}"),
            Pattern.compile("(\\S.{1,9}?)\\1{3,}", Pattern.DOTALL));
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public ErrorClass classify(String sourceText, Optional<String> translation) {
        String text = translation == null ? null : translation.orElse(null);
        if (text == null || text.isBlank() || text.strip().startsWith(FAILURE_SENTINEL)) {
            return ErrorClass.SOFT_ERROR;
        }
        String source = sourceText == null ? "" : sourceText;
        if (hasRunawayRepetition(source, text) || isEscapeMarker(source, text)) {
            return ErrorClass.HARD_ERROR;
        }
        return ErrorClass.SUCCESS;
    }

    /**
     * A translation that normalizes to its source, for a source that has letters to translate.
     */
    public boolean isMissedTranslation(String sourceText, Optional<String> translation) {
        if (sourceText == null || translation == null || translation.isEmpty()) {
            return false;
        }
        if (sourceText.codePoints().noneMatch(Character::isLetter)) {
            return false;
        }
        return normalize(sourceText).equals(normalize(translation.get()));
    }

    boolean hasRunawayRepetition(String source, String text) {
        for (Pattern rule : REPETITION_RULES) {
            Matcher matcher = rule.matcher(text);
            while (matcher.find()) {
                String unit = matcher.group(1);
                if (unit.chars().allMatch(ch -> Character.isDigit(ch) || Character.isWhitespace(ch))) {
                    continue;
                }
                if (!source.contains(matcher.group())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isEscapeMarker(String source, String text) {
        return isBracketWrapped(text.strip()) && !isBracketWrapped(source.strip());
    }

    private static boolean isBracketWrapped(String value) {
        return value.length() >= 2 && value.startsWith("[") && value.endsWith("]");
    }

    static String normalize(String value) {
        String normalized = Normalizer.normalize(value, Normalizer.Form.NFKC);
        return WHITESPACE.matcher(normalized).replaceAll(" ").strip().toLowerCase(Locale.ROOT);
    }
}

package ai.longform.translator.plan;

/**
 * Character based estimator: ideographic and full-width characters cost one token each, every
 * other character costs {@code 1 / charsPerToken} tokens, rounded up once per span.
 */
public class CharacterRatioTokenEstimator implements TokenEstimator {

    public static final double DEFAULT_CHARS_PER_TOKEN = 3.0;

    private final double charsPerToken;

    public CharacterRatioTokenEstimator() {
        this(DEFAULT_CHARS_PER_TOKEN);
    }

    public CharacterRatioTokenEstimator(double charsPerToken) {
        if (!(charsPerToken >= 1.0)) {
            throw new IllegalArgumentException("charsPerToken must be at least 1.0");
        }
        this.charsPerToken = charsPerToken;
    }

    @Override
    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        long wide = 0;
        long narrow = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            if (isWide(codePoint)) {
                wide++;
            } else {
                narrow++;
            }
            i += Character.charCount(codePoint);
        }
        long total = wide + (long) Math.ceil(narrow / charsPerToken);
        return total > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) total;
    }

    private static boolean isWide(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        switch (script) {
            case HAN, HIRAGANA, KATAKANA, HANGUL, THAI -> {
                return true;
            }
            default -> {
                // full-width forms block
                return codePoint >= 0xFF01 && codePoint <= 0xFF60;
            }
        }
    }
}

package ai.longform.translator.plan;

/**
 * Per-request token budget. The effective budget leaves headroom for target-language growth
 * and prompt overhead: {@code floor(configured / expansionFactor * safetyMargin)}.
 */
public record TokenBudget(int configuredTokens, double languageExpansionFactor, double safetyMargin) {

    public TokenBudget {
        if (configuredTokens < 1) {
            throw new IllegalArgumentException("configuredTokens must be at least 1");
        }
        if (!(languageExpansionFactor >= 1.0)) {
            throw new IllegalArgumentException("languageExpansionFactor must be at least 1.0");
        }
        if (!(safetyMargin > 0.0 && safetyMargin <= 1.0)) {
            throw new IllegalArgumentException("safetyMargin must be in (0.0, 1.0]");
        }
    }

    /**
     * Budget that is used as-is, without expansion or margin.
     */
    public static TokenBudget exactly(int tokens) {
        return new TokenBudget(tokens, 1.0, 1.0);
    }

    public int effective() {
        return Math.max(1, (int) Math.floor(configuredTokens / languageExpansionFactor * safetyMargin));
    }
}

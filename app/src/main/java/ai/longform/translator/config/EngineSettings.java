package ai.longform.translator.config;

import ai.longform.translator.plan.TokenBudget;
import ai.longform.translator.repair.UnresolvedUnitPolicy;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs of the translation engine.
 */
public record EngineSettings(int tokenBudget,
                             double languageExpansionFactor,
                             double tokenSafetyMargin,
                             int concurrencyLimit,
                             int maxRepairRounds,
                             Duration requestTimeout,
                             int maxRetryAttempts,
                             Duration initialBackoff,
                             Duration maxBackoff,
                             double retryJitterFactor,
                             UnresolvedUnitPolicy unresolvedUnitPolicy,
                             boolean missedTranslationCheck) {

    public static final int DEFAULT_TOKEN_BUDGET = 64_000;
    public static final double DEFAULT_LANGUAGE_EXPANSION_FACTOR = 3.0;
    public static final double DEFAULT_TOKEN_SAFETY_MARGIN = 0.9;
    public static final int DEFAULT_CONCURRENCY_LIMIT = 10;
    public static final int DEFAULT_MAX_REPAIR_ROUNDS = 3;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(300);
    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 5;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(60);
    public static final double DEFAULT_RETRY_JITTER_FACTOR = 0.3;

    public EngineSettings {
        require(tokenBudget >= 1, "token budget must be at least 1");
        require(languageExpansionFactor >= 1.0, "language expansion factor must be at least 1.0");
        require(tokenSafetyMargin > 0.0 && tokenSafetyMargin <= 1.0, "token safety margin must be in (0.0, 1.0]");
        require(concurrencyLimit >= 1, "concurrency limit must be at least 1");
        require(maxRepairRounds >= 1, "max repair rounds must be at least 1");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        require(!requestTimeout.isNegative() && !requestTimeout.isZero(), "request timeout must be positive");
        require(maxRetryAttempts >= 1, "max retry attempts must be at least 1");
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        require(!initialBackoff.isNegative(), "initial backoff must not be negative");
        require(maxBackoff.compareTo(initialBackoff) >= 0, "max backoff must be at least the initial backoff");
        require(retryJitterFactor >= 0.0 && retryJitterFactor <= 1.0, "retry jitter factor must be between 0.0 and 1.0");
        unresolvedUnitPolicy = Objects.requireNonNull(unresolvedUnitPolicy, "unresolvedUnitPolicy");
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_TOKEN_BUDGET, DEFAULT_LANGUAGE_EXPANSION_FACTOR, DEFAULT_TOKEN_SAFETY_MARGIN,
                DEFAULT_CONCURRENCY_LIMIT, DEFAULT_MAX_REPAIR_ROUNDS, DEFAULT_REQUEST_TIMEOUT,
                DEFAULT_MAX_RETRY_ATTEMPTS, DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF, DEFAULT_RETRY_JITTER_FACTOR,
                UnresolvedUnitPolicy.FALL_BACK_TO_SOURCE, true);
    }

    public TokenBudget budget() {
        return new TokenBudget(tokenBudget, languageExpansionFactor, tokenSafetyMargin);
    }

    public EngineSettings withMissedTranslationCheck(boolean enabled) {
        return new EngineSettings(tokenBudget, languageExpansionFactor, tokenSafetyMargin, concurrencyLimit,
                maxRepairRounds, requestTimeout, maxRetryAttempts, initialBackoff, maxBackoff, retryJitterFactor,
                unresolvedUnitPolicy, enabled);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }
}

package ai.longform.translator.plan;

/**
 * Approximates the LLM token cost of a text span for sizing decisions.
 *
 * <p>Implementations must be deterministic and monotonic in text length.
 */
@FunctionalInterface
public interface TokenEstimator {

    int estimate(String text);
}

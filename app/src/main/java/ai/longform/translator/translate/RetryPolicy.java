package ai.longform.translator.translate;

/**
 * Decides whether a failed attempt is retried. Implementations are pure functions of their
 * arguments (apart from jitter) and never sleep themselves.
 */
public interface RetryPolicy {

    /**
     * @param attempt zero-based index of the attempt that just failed
     * @param error the failure of that attempt
     */
    RetryDecision decide(int attempt, Throwable error);

    /**
     * Failures after which no other request in the same run should be issued.
     */
    boolean isPermanent(Throwable error);
}

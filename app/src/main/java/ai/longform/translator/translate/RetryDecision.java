package ai.longform.translator.translate;

import java.time.Duration;
import java.util.Objects;

public record RetryDecision(boolean retry, Duration delay) {

    private static final RetryDecision GIVE_UP = new RetryDecision(false, Duration.ZERO);

    public RetryDecision {
        delay = Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }

    public static RetryDecision giveUp() {
        return GIVE_UP;
    }
}

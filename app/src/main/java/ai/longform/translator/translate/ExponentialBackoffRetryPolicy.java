package ai.longform.translator.translate;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Retries transient failures with {@code initialBackoff * 2^attempt}, capped at
 * {@code maxBackoff} and spread by jitter. A retry hint from the provider wins over the
 * computed delay.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private static final Pattern RETRY_DELAY_PATTERN = Pattern.compile(
            "(?:retry in |retryDelay\"?:\\s*\")([0-9]+(?:\\.[0-9]+)?)s", Pattern.CASE_INSENSITIVE);
    private static final List<String> TRANSIENT_MARKERS = List.of(
            "RESOURCE_EXHAUSTED", "429", "UNAVAILABLE", "503", "502", "500 Internal", "DEADLINE_EXCEEDED");

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public ExponentialBackoffRetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff,
                                         double jitterFactor) {
        this(maxAttempts, initialBackoff, maxBackoff, jitterFactor, Math::random);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff,
                                         double jitterFactor, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least initialBackoff");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.jitterFactor = jitterFactor;
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public RetryDecision decide(int attempt, Throwable error) {
        if (attempt + 1 >= maxAttempts || isPermanent(error) || !isTransient(error)) {
            return RetryDecision.giveUp();
        }
        Optional<Duration> providerDelay = extractProviderRetryAfter(error);
        if (providerDelay.isPresent()) {
            return RetryDecision.retryAfter(min(providerDelay.get(), maxBackoff));
        }
        long baseMillis = initialBackoff.toMillis() * (1L << Math.min(attempt, 30));
        long cappedMillis = Math.min(baseMillis, maxBackoff.toMillis());
        double jitterMultiplier = 1.0 + (random.getAsDouble() * 2.0 - 1.0) * jitterFactor;
        long finalMillis = Math.max(0L, (long) (cappedMillis * jitterMultiplier));
        return RetryDecision.retryAfter(Duration.ofMillis(finalMillis));
    }

    @Override
    public boolean isPermanent(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException || cause instanceof NonRetriableException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    boolean isTransient(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof RateLimitException
                    || cause instanceof RetriableException
                    || cause instanceof RequestTimeoutException
                    || cause instanceof TimeoutException
                    || cause instanceof IOException) {
                return true;
            }
            String message = cause.getMessage();
            if (message != null && TRANSIENT_MARKERS.stream().anyMatch(message::contains)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private Optional<Duration> extractProviderRetryAfter(Throwable error) {
        Throwable cause = error;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null) {
                Matcher matcher = RETRY_DELAY_PATTERN.matcher(message);
                if (matcher.find()) {
                    double seconds = Double.parseDouble(matcher.group(1));
                    return Optional.of(Duration.ofMillis(Math.max(0L, (long) (seconds * 1000))));
                }
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}

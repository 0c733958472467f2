package ai.longform.translator.translate;

import ai.longform.translator.document.ContentUnit;
import ai.longform.translator.exchange.FragmentCodec;
import ai.longform.translator.exchange.MalformedResponseException;
import ai.longform.translator.exchange.PromptRenderer;
import ai.longform.translator.plan.FixTask;
import ai.longform.translator.plan.TranslationTask;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs translation tasks with at most {@code concurrencyLimit} requests in flight. Every
 * request gets its own timeout and is retried according to the {@link RetryPolicy}.
 */
public class TranslationExecutor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationExecutor.class);
    static final String MDC_TASK_ID = "taskId";
    static final String MDC_ROUND = "round";

    private final CompletionClient client;
    private final FragmentCodec codec;
    private final RetryPolicy retryPolicy;
    private final Duration requestTimeout;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ExecutorService workers;
    private final ExecutorService calls;
    private final Semaphore inFlight;

    public TranslationExecutor(CompletionClient client, FragmentCodec codec, RetryPolicy retryPolicy,
                               int concurrencyLimit, Duration requestTimeout) {
        this(client, codec, retryPolicy, concurrencyLimit, requestTimeout,
                duration -> Thread.sleep(duration.toMillis()), Clock.systemUTC());
    }

    TranslationExecutor(CompletionClient client, FragmentCodec codec, RetryPolicy retryPolicy,
                        int concurrencyLimit, Duration requestTimeout, Sleeper sleeper, Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1");
        }
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.workers = Executors.newFixedThreadPool(concurrencyLimit, daemonThreads("translation-worker-"));
        this.calls = Executors.newCachedThreadPool(daemonThreads("translation-call-"));
        this.inFlight = new Semaphore(concurrencyLimit);
    }

    /**
     * Executes the tasks of one round and returns one result per task, in task order.
     */
    public List<TranslationResult> execute(List<TranslationTask> tasks,
                                           Map<String, ContentUnit> units,
                                           PromptRenderer renderer,
                                           int round,
                                           ResponseLog responseLog) {
        Objects.requireNonNull(units, "units");
        Objects.requireNonNull(renderer, "renderer");
        Objects.requireNonNull(responseLog, "responseLog");
        if (tasks == null || tasks.isEmpty()) {
            return List.of();
        }
        AtomicBoolean permanentFailure = new AtomicBoolean(false);
        List<Future<TranslationResult>> futures = new ArrayList<>(tasks.size());
        for (TranslationTask task : tasks) {
            futures.add(workers.submit(() -> runTask(task, units, renderer, round, responseLog, permanentFailure)));
        }
        List<TranslationResult> results = new ArrayList<>(tasks.size());
        for (int i = 0; i < futures.size(); i++) {
            TranslationTask task = tasks.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException ex) {
                LOGGER.error("Task {} failed unexpectedly", task.taskId(), ex.getCause());
                results.add(TranslationResult.failed(task, null, String.valueOf(ex.getCause())));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                throw new TranslationException("Interrupted while waiting for round " + round, ex);
            }
        }
        long failed = results.stream().filter(TranslationResult::isFailed).count();
        LOGGER.info("Round {}: {} tasks finished, {} failed", round, results.size(), failed);
        return results;
    }

    private TranslationResult runTask(TranslationTask task,
                                      Map<String, ContentUnit> units,
                                      PromptRenderer renderer,
                                      int round,
                                      ResponseLog responseLog,
                                      AtomicBoolean permanentFailure) {
        MDC.put(MDC_TASK_ID, task.taskId());
        MDC.put(MDC_ROUND, String.valueOf(round));
        try {
            String prompt = renderer.render(task, units);
            for (int attempt = 0; ; attempt++) {
                if (permanentFailure.get()) {
                    String message = "Skipped after a permanent failure in this round";
                    responseLog.append(logEntry(task, round, attempt, null, message));
                    return TranslationResult.failed(task, null, message);
                }
                String response;
                try {
                    LOGGER.debug("Sending {} task with {} units (attempt {})", describe(task), task.unitIds().size(),
                            attempt + 1);
                    response = call(prompt);
                } catch (TranslationException ex) {
                    responseLog.append(logEntry(task, round, attempt, null, ex.getMessage()));
                    RetryDecision decision = retryPolicy.decide(attempt, ex);
                    if (!decision.retry()) {
                        if (retryPolicy.isPermanent(ex)) {
                            permanentFailure.set(true);
                        }
                        LOGGER.error("Task {} failed after {} attempts: {}", task.taskId(), attempt + 1, ex.getMessage());
                        return TranslationResult.failed(task, null, ex.getMessage());
                    }
                    LOGGER.warn("Task {} attempt {} failed ({}); retrying in {} ms", task.taskId(), attempt + 1,
                            ex.getMessage(), decision.delay().toMillis());
                    try {
                        sleeper.sleep(decision.delay());
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                        return TranslationResult.failed(task, null, "Interrupted while backing off");
                    }
                    continue;
                }
                responseLog.append(logEntry(task, round, attempt, response, null));
                try {
                    return TranslationResult.success(task, response,
                            codec.deserialize(task.variant(), task.unitIds(), response));
                } catch (MalformedResponseException ex) {
                    LOGGER.warn("Task {} returned a malformed response: {}", task.taskId(), ex.getMessage());
                    return TranslationResult.failed(task, response, ex.getMessage());
                }
            }
        } finally {
            MDC.remove(MDC_TASK_ID);
            MDC.remove(MDC_ROUND);
        }
    }

    /**
     * A permit is held until the client call really returns, so a timed-out request that
     * ignores interruption still counts against the in-flight limit.
     */
    private String call(String prompt) {
        try {
            inFlight.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Interrupted while waiting for a request slot", ex);
        }
        // 0 = queued, 1 = running, 2 = abandoned before start; whoever leaves 0 owns the permit
        AtomicInteger state = new AtomicInteger();
        Map<String, String> context = MDC.getCopyOfContextMap();
        Future<String> call;
        try {
            call = calls.submit(() -> {
                if (!state.compareAndSet(0, 1)) {
                    return null;
                }
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    return client.complete(prompt);
                } finally {
                    MDC.clear();
                    inFlight.release();
                }
            });
        } catch (RuntimeException ex) {
            inFlight.release();
            throw new TranslationException("Could not submit completion call", ex);
        }
        try {
            return call.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            abandon(call, state);
            throw new RequestTimeoutException("Request timed out after " + requestTimeout.toMillis() + " ms", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof TranslationException translationException) {
                throw translationException;
            }
            throw new TranslationException("Completion call failed: " + cause, cause);
        } catch (InterruptedException ex) {
            abandon(call, state);
            Thread.currentThread().interrupt();
            throw new TranslationException("Interrupted while waiting for completion", ex);
        }
    }

    private void abandon(Future<String> call, AtomicInteger state) {
        if (state.compareAndSet(0, 2)) {
            inFlight.release();
        }
        call.cancel(true);
    }

    private static String describe(TranslationTask task) {
        if (task instanceof FixTask fix) {
            return task.variant() + " (" + fix.reason() + ")";
        }
        return task.variant().toString();
    }

    private ResponseLogEntry logEntry(TranslationTask task, int round, int attempt, String response, String error) {
        return new ResponseLogEntry(task.taskId(), task.variant(), round, attempt + 1, clock.instant(),
                Optional.ofNullable(response), Optional.ofNullable(error));
    }

    @Override
    public void close() {
        workers.shutdownNow();
        calls.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}

package com.jreinhal.insight.routing;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Attempt bound, per-attempt timeout, overall deadline and jittered exponential backoff for
 * model calls.
 *
 * <p>Each call gets its own resilience4j {@link Retry}; every attempt runs on the supplied
 * executor under a {@link TimeLimiter} capped by the time left before the deadline. A retry
 * whose backoff would end past the deadline is not attempted.</p>
 */
@Component
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final double BACKOFF_JITTER = 0.3;

    private final int maxAttempts;
    private final long attemptTimeoutMs;
    private final long overallDeadlineMs;
    private final IntervalFunction backoff;
    private final Consumer<RetryOnRetryEvent> retryListener;

    @Autowired
    public RetryPolicy(@Value("${insight.router.max-attempts:3}") int maxAttempts,
                       @Value("${insight.router.base-delay-ms:800}") long baseDelayMs,
                       @Value("${insight.router.max-delay-ms:10000}") long maxDelayMs,
                       @Value("${insight.router.attempt-timeout-ms:15000}") long attemptTimeoutMs,
                       @Value("${insight.router.overall-deadline-ms:45000}") long overallDeadlineMs) {
        this(maxAttempts, attemptTimeoutMs, overallDeadlineMs,
                IntervalFunction.ofExponentialRandomBackoff(Math.max(1L, baseDelayMs), BACKOFF_MULTIPLIER, BACKOFF_JITTER,
                        Math.max(Math.max(1L, baseDelayMs), maxDelayMs)),
                event -> {});
    }

    public RetryPolicy(int maxAttempts, long attemptTimeoutMs, long overallDeadlineMs, IntervalFunction backoff,
                       Consumer<RetryOnRetryEvent> retryListener) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.attemptTimeoutMs = Math.max(1L, attemptTimeoutMs);
        this.overallDeadlineMs = Math.max(this.attemptTimeoutMs, overallDeadlineMs);
        this.backoff = backoff;
        this.retryListener = retryListener;
    }

    /**
     * Runs {@code task} until it succeeds, fails with something {@code retryable} rejects,
     * runs out of attempts or reaches the deadline. The last failure is rethrown; a deadline
     * hit before an attempt could start surfaces as {@link DeadlineExceededException}.
     */
    public <T> T execute(String name, ExecutorService executor, Callable<T> task, Predicate<Throwable> retryable,
                         Attempts attempts) throws Exception {
        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(this.overallDeadlineMs);
        AtomicLong plannedDelay = new AtomicLong();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(this.maxAttempts)
                .intervalFunction(attempt -> plannedDelay.get())
                .retryOnException(failure -> {
                    if (failure instanceof DeadlineExceededException || !retryable.test(failure)) {
                        return false;
                    }
                    if (attempts.count() >= this.maxAttempts) {
                        return true;
                    }
                    long delay = this.delayBeforeRetry(attempts.count());
                    if (delay >= remainingMillis(deadlineNanos)) {
                        attempts.deadlineReached = true;
                        return false;
                    }
                    plannedDelay.set(delay);
                    return true;
                })
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> {
            log.warn("{} attempt {}/{} failed, retrying in {}ms: {}", name, event.getNumberOfRetryAttempts(), this.maxAttempts,
                    event.getWaitInterval().toMillis(), event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getClass().getSimpleName());
            this.retryListener.accept(event);
        });
        return retry.executeCallable(() -> {
            long remainingMs = remainingMillis(deadlineNanos);
            if (remainingMs <= 0L) {
                attempts.deadlineReached = true;
                throw new DeadlineExceededException(name + " deadline of " + this.overallDeadlineMs + "ms exceeded");
            }
            attempts.count++;
            TimeLimiter limiter = TimeLimiter.of(name, TimeLimiterConfig.custom()
                    .timeoutDuration(Duration.ofMillis(Math.min(this.attemptTimeoutMs, remainingMs)))
                    .cancelRunningFuture(true)
                    .build());
            return limiter.executeFutureSupplier(() -> executor.submit(task));
        });
    }

    public long delayBeforeRetry(int failedAttempt) {
        return this.backoff.apply(Math.max(1, failedAttempt));
    }

    public int maxAttempts() {
        return this.maxAttempts;
    }

    public long attemptTimeoutMs() {
        return this.attemptTimeoutMs;
    }

    public long overallDeadlineMs() {
        return this.overallDeadlineMs;
    }

    private static long remainingMillis(long deadlineNanos) {
        return TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
    }

    /**
     * Attempt bookkeeping for a single {@link #execute} call.
     */
    public static final class Attempts {
        private int count;
        private boolean deadlineReached;

        public int count() {
            return this.count;
        }

        public boolean deadlineReached() {
            return this.deadlineReached;
        }
    }

    public static class DeadlineExceededException extends RuntimeException {
        public DeadlineExceededException(String message) {
            super(message);
        }
    }
}

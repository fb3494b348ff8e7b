package dev.orderscanner.support;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Bounded retry with linearly increasing delay: retry n waits {@code base * n}.
 * Non-matching errors and errors past the budget propagate unchanged.
 */
public final class LinearBackoffRetry {

    private LinearBackoffRetry() {
    }

    public static Retry of(int maxRetries, Duration baseDelay, Predicate<Throwable> retryable) {
        return of(maxRetries, baseDelay, retryable, Schedulers.parallel(), (attempt, delay, error) -> { });
    }

    public static Retry of(int maxRetries, Duration baseDelay, Predicate<Throwable> retryable,
                           Scheduler scheduler, RetryListener listener) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries() + 1;
            if (!retryable.test(failure) || attempt > maxRetries) {
                return Mono.error(failure);
            }
            Duration delay = baseDelay.multipliedBy(attempt);
            listener.beforeRetry(attempt, delay, failure);
            return Mono.delay(delay, scheduler);
        }));
    }

    @FunctionalInterface
    public interface RetryListener {
        void beforeRetry(long attempt, Duration delay, Throwable failure);
    }
}

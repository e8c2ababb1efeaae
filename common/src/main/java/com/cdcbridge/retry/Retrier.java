package com.cdcbridge.retry;

import lombok.extern.slf4j.Slf4j;

import java.io.Serializable;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Runs an operation under a {@link RetryPolicy}, sleeping between attempts.
 *
 * <p>Only failures accepted by the {@code retryable} predicate are retried; anything
 * else propagates immediately. Once attempts are exhausted the last failure is handed
 * to {@code onExhausted}, which decides the exception surfaced to the caller.</p>
 */
@Slf4j
public class Retrier implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Pause between attempts. Swappable so tests do not sleep.
     */
    @FunctionalInterface
    public interface Sleeper extends Serializable {
        void sleep(long millis) throws InterruptedException;
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public Retrier(RetryPolicy policy) {
        this(policy, Thread::sleep);
    }

    public Retrier(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public <T> T call(String operation,
                      Callable<T> action,
                      Predicate<Throwable> retryable,
                      Function<Exception, ? extends RuntimeException> onExhausted) {
        int maxAttempts = Math.max(1, policy.getMaxAttempts());
        for (int attempt = 1; ; attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                if (!retryable.test(e)) {
                    if (e instanceof RuntimeException) {
                        throw (RuntimeException) e;
                    }
                    throw onExhausted.apply(e);
                }
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw onExhausted.apply(e);
                }
                long backoff = policy.backoffAfter(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, backoff, e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw onExhausted.apply(e);
                }
            }
        }
    }
}

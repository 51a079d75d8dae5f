package com.poolradar.client;

import com.poolradar.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Caller-level retry for API calls. Only {@link TransportException} is retried; remote errors, decode
 * errors and cancellation propagate on the first occurrence.
 */
@Slf4j
public class RetryingCall {

    /**
     * Pause between attempts; swapped out in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public RetryingCall(RetryPolicy retryPolicy) {
        this(retryPolicy, Thread::sleep);
    }

    public RetryingCall(RetryPolicy retryPolicy, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public <T> T call(String description, Supplier<T> call) {
        return call(description, call, CancellationToken.create());
    }

    /**
     * Run {@code call}, retrying transport failures up to the policy's attempt limit. The token is
     * checked before every retry.
     */
    public <T> T call(String description, Supplier<T> call, CancellationToken token) {
        int maxAttempts = retryPolicy.getMaxAttempts();
        for (int attempt = 0; ; attempt++) {
            try {
                return call.get();
            } catch (TransportException e) {
                if (attempt + 1 >= maxAttempts) {
                    log.warn("{} failed after {} attempt(s): {}", description, attempt + 1, e.getMessage());
                    throw e;
                }
                long delay = retryPolicy.delayMs(attempt);
                log.debug("{} transport failure (attempt {}/{}), retrying in {}ms: {}",
                        description, attempt + 1, maxAttempts, delay, e.getMessage());
                pause(delay, description);
                token.throwIfCancelled();
            }
        }
    }

    private void pause(long delayMs, String description) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("Interrupted while waiting to retry " + description, e);
        }
    }
}

package com.poolradar.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Cancellation signal with an optional deadline, shared by every request of one logical operation.
 * Once fired it stays fired.
 */
public final class CancellationToken {

    private final Instant deadline;
    private final Clock clock;
    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * Token without deadline; fires only on {@link #cancel()}.
     */
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        return withDeadline(clock.instant().plus(timeout), clock);
    }

    /**
     * Token that fires once {@code clock} reaches {@code deadline}, or earlier on {@link #cancel()}.
     */
    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline is required");
        }
        return new CancellationToken(deadline, clock);
    }

    public void cancel() {
        cancelled.complete(null);
    }

    public boolean isCancelled() {
        return cancelled.isDone() || isDeadlineExceeded();
    }

    private boolean isDeadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left until the deadline (zero once passed); empty when the token has no deadline.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Completes when {@link #cancel()} is called. Deadline expiry is not signalled here; waiters bound
     * their wait by {@link #remaining()}.
     */
    public CompletableFuture<Void> whenCancelled() {
        return cancelled.copy();
    }

    public void throwIfCancelled() {
        if (cancelled.isDone()) {
            throw new RequestCancelledException("Request cancelled");
        }
        if (isDeadlineExceeded()) {
            throw new RequestCancelledException("Deadline exceeded at " + deadline);
        }
    }
}

package com.poolradar.batch;

import java.util.Objects;
import java.util.Optional;

/**
 * Result for one batch target: either a value or the error that target failed with.
 */
public final class BatchOutcome<V> {

    private final TaskState state;
    private final V value;
    private final RuntimeException error;

    private BatchOutcome(TaskState state, V value, RuntimeException error) {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Outcome state must be terminal: " + state);
        }
        this.state = state;
        this.value = value;
        this.error = error;
    }

    public static <V> BatchOutcome<V> success(V value) {
        return new BatchOutcome<>(TaskState.SUCCEEDED, value, null);
    }

    public static <V> BatchOutcome<V> failure(RuntimeException error) {
        return new BatchOutcome<>(TaskState.FAILED, null, Objects.requireNonNull(error, "error"));
    }

    public static <V> BatchOutcome<V> cancelled(RuntimeException error) {
        return new BatchOutcome<>(TaskState.CANCELLED, null, Objects.requireNonNull(error, "error"));
    }

    public TaskState getState() {
        return state;
    }

    public boolean isSuccess() {
        return state == TaskState.SUCCEEDED;
    }

    public Optional<V> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * Value of a successful outcome; rethrows the target's error otherwise.
     */
    public V getOrThrow() {
        if (!isSuccess()) {
            throw error;
        }
        return value;
    }

    public Optional<RuntimeException> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "BatchOutcome[" + state + "]" : "BatchOutcome[" + state + ": " + error.getMessage() + "]";
    }
}

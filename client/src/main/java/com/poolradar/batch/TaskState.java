package com.poolradar.batch;

/**
 * Lifecycle of one batch target: PENDING -> RUNNING -> {SUCCEEDED, FAILED}. A target that observes the
 * cancellation token ends CANCELLED, either while still PENDING (waiting for a permit) or while RUNNING.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}

package com.poolradar.batch;

/**
 * Carries a non-exception throwable (an {@link Error}) raised by one batch target, so it can be kept as
 * that target's failed outcome.
 */
public class BatchTaskException extends RuntimeException {

    public BatchTaskException(Object target, Throwable cause) {
        super("Batch target " + target + " failed: " + cause, cause);
    }
}

package com.poolradar.batch;

/**
 * Observer of per-target state changes during a dispatch.
 */
@FunctionalInterface
public interface TaskStateListener<K> {

    void onTransition(K target, TaskState state);

    static <K> TaskStateListener<K> none() {
        return (target, state) -> {
        };
    }
}

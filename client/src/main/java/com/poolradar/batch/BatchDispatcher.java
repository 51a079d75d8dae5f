package com.poolradar.batch;

import com.poolradar.client.CancellationToken;
import com.poolradar.client.RequestCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Fans one task per distinct target out onto an executor and joins the results into a map keyed by
 * target, in target order. A failing target only produces a failed outcome for itself; cancellation
 * of the shared token aborts the whole batch with {@link RequestCancelledException}.
 */
@Slf4j
public class BatchDispatcher {

    private static final long POLL_INTERVAL_MS = 50;

    private final Executor executor;
    private final int maxConcurrency;

    /**
     * @param maxConcurrency maximum tasks running at once; 0 means unbounded
     */
    public BatchDispatcher(Executor executor, int maxConcurrency) {
        if (maxConcurrency < 0) {
            throw new IllegalArgumentException("maxConcurrency must be >= 0");
        }
        this.executor = executor;
        this.maxConcurrency = maxConcurrency;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public <K, V> Map<K, BatchOutcome<V>> dispatch(Collection<K> targets, Function<K, V> task) {
        return dispatch(targets, task, CancellationToken.create());
    }

    /**
     * Run {@code task} for every distinct target and wait for all of them.
     *
     * @return one outcome per distinct target, in first-seen target order
     * @throws RequestCancelledException if the token fires before every target has finished
     */
    public <K, V> Map<K, BatchOutcome<V>> dispatch(Collection<K> targets, Function<K, V> task,
                                                    CancellationToken token) {
        return dispatch(targets, task, token, TaskStateListener.none());
    }

    /**
     * As {@link #dispatch(Collection, Function, CancellationToken)}, reporting every state change of every
     * target to {@code listener}. Transitions are reported from the thread that caused them.
     */
    public <K, V> Map<K, BatchOutcome<V>> dispatch(Collection<K> targets, Function<K, V> task,
                                                    CancellationToken token, TaskStateListener<? super K> listener) {
        List<K> distinct = new ArrayList<>(new LinkedHashSet<>(targets));
        Map<K, CompletableFuture<BatchOutcome<V>>> futures = new LinkedHashMap<>();
        Semaphore semaphore = maxConcurrency > 0 ? new Semaphore(maxConcurrency) : null;

        for (K target : distinct) {
            if (token.isCancelled()) {
                cancelAll(futures.values());
                token.throwIfCancelled();
            }
            report(listener, target, TaskState.PENDING);
            futures.put(target, submit(target, task, token, semaphore, listener));
        }

        awaitAll(futures.values(), token);

        Map<K, BatchOutcome<V>> results = new LinkedHashMap<>();
        int failed = 0;
        for (Map.Entry<K, CompletableFuture<BatchOutcome<V>>> entry : futures.entrySet()) {
            BatchOutcome<V> outcome = entry.getValue().join();
            if (outcome.getState() == TaskState.CANCELLED) {
                throw (RequestCancelledException) outcome.getError().orElseThrow();
            }
            if (!outcome.isSuccess()) {
                failed++;
            }
            results.put(entry.getKey(), outcome);
        }
        log.debug("Batch of {} target(s) finished: {} succeeded, {} failed", results.size(), results.size() - failed, failed);
        return results;
    }

    private <K, V> CompletableFuture<BatchOutcome<V>> submit(K target, Function<K, V> task, CancellationToken token,
                                                              Semaphore semaphore, TaskStateListener<? super K> listener) {
        try {
            return CompletableFuture.supplyAsync(() -> runOne(target, task, token, semaphore, listener), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Batch target {} rejected by executor: {}", target, e.getMessage());
            report(listener, target, TaskState.FAILED);
            return CompletableFuture.completedFuture(BatchOutcome.failure(e));
        }
    }

    private <K, V> BatchOutcome<V> runOne(K target, Function<K, V> task, CancellationToken token, Semaphore semaphore,
                                          TaskStateListener<? super K> listener) {
        BatchOutcome<V> outcome = execute(target, task, token, semaphore, listener);
        report(listener, target, outcome.getState());
        return outcome;
    }

    private <K, V> BatchOutcome<V> execute(K target, Function<K, V> task, CancellationToken token, Semaphore semaphore,
                                           TaskStateListener<? super K> listener) {
        boolean acquired = false;
        try {
            token.throwIfCancelled();
            if (semaphore != null) {
                // queued targets give up their place as soon as the token fires
                while (!semaphore.tryAcquire(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                    token.throwIfCancelled();
                }
                acquired = true;
            }
            token.throwIfCancelled();
            report(listener, target, TaskState.RUNNING);
            return BatchOutcome.success(task.apply(target));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BatchOutcome.cancelled(new RequestCancelledException("Interrupted before running " + target, e));
        } catch (RequestCancelledException e) {
            return BatchOutcome.cancelled(e);
        } catch (RuntimeException e) {
            log.warn("Batch target {} failed: {}", target, e.getMessage());
            return BatchOutcome.failure(e);
        } catch (Throwable e) {
            log.error("Batch target {} failed with {}", target, e.toString(), e);
            return BatchOutcome.failure(new BatchTaskException(target, e));
        } finally {
            if (acquired) {
                semaphore.release();
            }
        }
    }

    private static <K> void report(TaskStateListener<? super K> listener, K target, TaskState state) {
        try {
            listener.onTransition(target, state);
        } catch (RuntimeException e) {
            log.warn("Task state listener failed for {} -> {}: {}", target, state, e.getMessage());
        }
    }

    private void awaitAll(Collection<? extends CompletableFuture<?>> futures, CancellationToken token) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        CompletableFuture<Object> allOrCancelled = CompletableFuture.anyOf(all, token.whenCancelled());
        try {
            while (!all.isDone()) {
                if (token.isCancelled()) {
                    break;
                }
                long waitMs = token.remaining()
                        .map(Duration::toMillis)
                        .map(left -> Math.max(1, Math.min(left, POLL_INTERVAL_MS)))
                        .orElse(POLL_INTERVAL_MS);
                try {
                    allOrCancelled.get(waitMs, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    log.trace("Still waiting on batch; polling again");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new RequestCancelledException("Interrupted while waiting for batch", e);
        } catch (ExecutionException e) {
            // outcomes never complete exceptionally; surface it if that ever changes
            throw new IllegalStateException("Batch future failed", e.getCause());
        }
        if (!all.isDone() && token.isCancelled()) {
            cancelAll(futures);
            log.info("Batch cancelled with {} of {} target(s) unfinished",
                    futures.stream().filter(f -> !f.isDone() || f.isCancelled()).count(), futures.size());
            token.throwIfCancelled();
        }
    }

    private static void cancelAll(Collection<? extends CompletableFuture<?>> futures) {
        futures.forEach(f -> f.cancel(false));
    }
}

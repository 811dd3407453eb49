package com.github.mwbot.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Common bookkeeping of the bulk schedulers: worker invocation, the success/failure
 * tally and progress notifications. Subclasses decide when each item is dispatched.
 *
 * @param <T> item type
 */
public abstract class AbstractBatchOperation<T> {
    protected final List<T> items;
    private final BatchWorker<? super T> worker;
    private final Consumer<BatchProgress> listener;
    private final CompletableFuture<BatchResult> result = new CompletableFuture<>();
    private final Logger logger = Logger.getLogger("mwbot.batch");

    private int successes;
    private int failures;

    protected AbstractBatchOperation(List<? extends T> items, BatchWorker<? super T> worker,
            Consumer<BatchProgress> listener) {
        this.items = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(items)));
        this.worker = Objects.requireNonNull(worker);
        this.listener = listener != null ? listener : progress -> {};
    }

    /**
     * Starts the operation. The returned future completes once every item has settled
     * and never fails because of a worker failure.
     *
     * @throws IllegalStateException a worker invoked before this method returns gave back
     * {@code null} instead of a stage
     */
    public final CompletableFuture<BatchResult> execute() {
        if (items.isEmpty()) {
            result.complete(new BatchResult(0, 0));
        } else {
            start();
        }

        return result;
    }

    protected abstract void start();

    /**
     * Runs the worker on one item.
     *
     * @return a future completed after the item's outcome has been tallied
     * @throws IllegalStateException the worker returned {@code null}
     */
    protected final CompletableFuture<Void> dispatch(int index) {
        CompletionStage<?> stage;

        try {
            stage = worker.apply(items.get(index), index);
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        if (stage == null) {
            throw new IllegalStateException(String.format(
                "%s worker function must return a CompletionStage, got null for item %d",
                getClass().getSimpleName(), index));
        }

        var settled = new CompletableFuture<Void>();

        stage.whenComplete((value, error) -> {
            try {
                settle(index, error);
            } finally {
                settled.complete(null);
            }
        });

        return settled;
    }

    /**
     * Runs a dispatching step from a completion callback, where a programmer error can
     * only be reported through the result future.
     */
    protected final void continueWith(Runnable step) {
        try {
            step.run();
        } catch (IllegalStateException e) {
            logger.logp(Level.SEVERE, getClass().getSimpleName(), "continueWith", "Aborting batch", e);
            result.completeExceptionally(e);
        }
    }

    protected final void complete() {
        synchronized (this) {
            result.complete(new BatchResult(successes, failures));
        }
    }

    private void settle(int index, Throwable error) {
        BatchProgress progress;

        synchronized (this) {
            if (error == null) {
                successes++;
            } else {
                failures++;
            }

            progress = new BatchProgress(successes, failures, items.size());
        }

        if (error != null) {
            logger.logp(Level.WARNING, getClass().getSimpleName(), "settle",
                String.format("Item %d (%s) failed: %s", index, items.get(index), error.getMessage()));
        }

        try {
            listener.accept(progress);
        } catch (RuntimeException e) {
            logger.logp(Level.WARNING, getClass().getSimpleName(), "settle", "Progress listener failed", e);
        }
    }
}

package com.github.mwbot.batch;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs a worker over a list one item at a time, pausing between the settlement of an
 * item and the dispatch of the next one. There is no pause after the last item.
 *
 * @param <T> item type
 */
public final class SeriesBatchOperation<T> extends AbstractBatchOperation<T> {
    private final Duration delay;

    public SeriesBatchOperation(List<? extends T> items, BatchWorker<? super T> worker, Duration delay,
            Consumer<BatchProgress> listener) {
        super(items, worker, listener);

        if (Objects.requireNonNull(delay).isNegative()) {
            throw new IllegalArgumentException("negative delay: " + delay);
        }

        this.delay = delay;
    }

    public static <T> CompletableFuture<BatchResult> run(List<? extends T> items, BatchWorker<? super T> worker,
            Duration delay, Consumer<BatchProgress> listener) {
        return new SeriesBatchOperation<T>(items, worker, delay, listener).execute();
    }

    @Override
    protected void start() {
        trigger(0);
    }

    private void trigger(int index) {
        dispatch(index).thenRun(() -> {
            if (index + 1 >= items.size()) {
                complete();
            } else {
                var executor = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS);
                CompletableFuture.runAsync(() -> continueWith(() -> trigger(index + 1)), executor);
            }
        });
    }
}

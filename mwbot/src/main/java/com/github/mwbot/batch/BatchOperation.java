package com.github.mwbot.batch;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Runs a worker over a list in consecutive groups of {@code concurrency} items. All
 * members of a group are dispatched at once; the next group starts after every member
 * of the current one has settled.
 *
 * @param <T> item type
 */
public final class BatchOperation<T> extends AbstractBatchOperation<T> {
    private final int concurrency;

    public BatchOperation(List<? extends T> items, BatchWorker<? super T> worker, int concurrency,
            Consumer<BatchProgress> listener) {
        super(items, worker, listener);

        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }

        this.concurrency = concurrency;
    }

    public static <T> CompletableFuture<BatchResult> run(List<? extends T> items, BatchWorker<? super T> worker,
            int concurrency, Consumer<BatchProgress> listener) {
        return new BatchOperation<T>(items, worker, concurrency, listener).execute();
    }

    @Override
    protected void start() {
        final int to = Math.min(concurrency, items.size());
        dispatchGroup(0, to).thenRun(() -> continueWith(() -> sendGroups(to)));
    }

    /**
     * Sends the remaining groups. Groups whose items settle synchronously are handled in
     * place; the first pending group resumes this loop from its completion.
     */
    private void sendGroups(int from) {
        int next = from;

        while (next < items.size()) {
            final int to = Math.min(next + concurrency, items.size());
            var barrier = dispatchGroup(next, to);

            if (!barrier.isDone()) {
                barrier.thenRun(() -> continueWith(() -> sendGroups(to)));
                return;
            }

            next = to;
        }

        complete();
    }

    private CompletableFuture<Void> dispatchGroup(int from, int to) {
        var group = new CompletableFuture<?>[to - from];

        for (int i = from; i < to; i++) {
            group[i - from] = dispatch(i);
        }

        return CompletableFuture.allOf(group);
    }
}

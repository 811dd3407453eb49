package com.github.mwbot.api;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Keeps the call counters around the actual dispatch.
 */
public abstract class AbstractTransport implements Transport {
    private final CallStatistics statistics = new CallStatistics();

    @Override
    public final CompletableFuture<Object> send(ApiRequest request) {
        statistics.recordDispatched();
        statistics.recordResolved();

        if (request.getOptions().getUri() == null) {
            statistics.recordRejected();
            return CompletableFuture.failedFuture(new IOException("No URI provided!"));
        }

        CompletableFuture<Object> future;

        try {
            future = dispatch(request);
        } catch (IOException | RuntimeException e) {
            statistics.recordRejected();
            return CompletableFuture.failedFuture(e);
        }

        return future.whenComplete((body, error) -> {
            if (error == null) {
                statistics.recordFulfilled();
            } else {
                statistics.recordRejected();
            }
        });
    }

    @Override
    public CallStatistics getStatistics() {
        return statistics;
    }

    protected abstract CompletableFuture<Object> dispatch(ApiRequest request) throws IOException;
}

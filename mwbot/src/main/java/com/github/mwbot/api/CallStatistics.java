package com.github.mwbot.api;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic counters of transport calls. {@code total} grows when a call is dispatched,
 * the other three when it settles, so {@code resolved == fulfilled + rejected} holds once
 * nothing is in flight.
 */
public final class CallStatistics {
    private final AtomicLong total = new AtomicLong();
    private final AtomicLong resolved = new AtomicLong();
    private final AtomicLong fulfilled = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    void recordDispatched() {
        total.incrementAndGet();
    }

    void recordResolved() {
        resolved.incrementAndGet();
    }

    void recordFulfilled() {
        fulfilled.incrementAndGet();
    }

    void recordRejected() {
        rejected.incrementAndGet();
    }

    public long getTotal() {
        return total.get();
    }

    public long getResolved() {
        return resolved.get();
    }

    public long getFulfilled() {
        return fulfilled.get();
    }

    public long getRejected() {
        return rejected.get();
    }

    @Override
    public String toString() {
        return String.format("[total=%d, resolved=%d, fulfilled=%d, rejected=%d]",
            getTotal(), getResolved(), getFulfilled(), getRejected());
    }
}

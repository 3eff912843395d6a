package com.orderbook.engine.stats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free book counters. Each counter is independently atomic; a snapshot is not
 * a consistent cut across the three, only each value on its own is exact.
 * Callers record only operations that succeeded.
 */
public final class StatsAggregator {

    private final AtomicLong placed = new AtomicLong();
    private final AtomicLong matched = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();

    public void recordPlaced() {
        placed.incrementAndGet();
    }

    public void recordCancelled() {
        cancelled.incrementAndGet();
    }

    /** Adds {@code pairs} successful matches; called once per batch. */
    public void recordMatched(long pairs) {
        if (pairs < 0) throw new IllegalArgumentException("Negative match count: " + pairs);
        if (pairs > 0) matched.addAndGet(pairs);
    }

    public BookStats snapshot() {
        return new BookStats(placed.get(), matched.get(), cancelled.get());
    }
}

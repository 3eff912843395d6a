package com.orderbook.engine.book;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Conflict-free order id counter. Ids start at 1; 0 is the "not found" sentinel.
 * Safe for any number of concurrent callers: every call to {@link #next()}
 * observes a distinct value.
 */
public final class IdentifierAllocator {

    public static final long NONE = 0L;

    private final AtomicLong last = new AtomicLong(NONE);

    public long next() {
        return last.incrementAndGet();
    }

    /** Last id handed out, or {@link #NONE} before the first allocation. */
    public long current() {
        return last.get();
    }
}

package com.orderbook.engine.book;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierAllocatorTest {

    @Test
    void testSequenceStartsAtOne() {
        IdentifierAllocator ids = new IdentifierAllocator();
        assertEquals(IdentifierAllocator.NONE, ids.current());
        assertEquals(1, ids.next());
        assertEquals(2, ids.next());
        assertEquals(2, ids.current());
    }

    @Test
    void testConcurrentCallersNeverShareAnId() throws Exception {
        IdentifierAllocator ids = new IdentifierAllocator();
        int threads = 16;
        int perThread = 5_000;
        Set<Long> seen = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        assertTrue(seen.add(ids.next()), "duplicate id issued");
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        long total = (long) threads * perThread;
        assertEquals(total, seen.size());
        assertEquals(total, ids.current(), "no gaps: last id equals number issued");
        assertFalse(seen.contains(0L));
    }
}

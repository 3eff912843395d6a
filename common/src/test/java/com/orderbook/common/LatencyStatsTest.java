package com.orderbook.common;

import org.HdrHistogram.Histogram;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LatencyStatsTest {

    @Test
    void testConcurrentRecordingIsFullyCounted() throws Exception {
        LatencyStats stats = new LatencyStats("place");
        int threads = 8;
        int perThread = 10_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 1; i <= perThread; i++) stats.record(i * 100L);
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        Histogram h = stats.drain();
        assertEquals((long) threads * perThread, h.getTotalCount());
    }

    @Test
    void testLogAndResetDrainsInterval() {
        LatencyStats stats = new LatencyStats("cancel");
        stats.record(1_500);
        stats.record(-5); // clock skew clamps to zero

        assertEquals(2, stats.logAndReset());
        assertEquals(0, stats.logAndReset(), "second interval is empty");
    }
}

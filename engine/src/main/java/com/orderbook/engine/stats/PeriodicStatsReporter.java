package com.orderbook.engine.stats;

import com.orderbook.common.LatencyStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Logs book counters and operation latencies every N seconds on a daemon thread.
 * Never touches order state; callers are never blocked by reporting.
 */
public final class PeriodicStatsReporter {

    private static final Logger log = LoggerFactory.getLogger(PeriodicStatsReporter.class);

    private final StatsAggregator stats;
    private final List<LatencyStats> latencies;
    private final int intervalSeconds;
    private final ScheduledExecutorService scheduler;

    private BookStats last = new BookStats(0, 0, 0);

    public PeriodicStatsReporter(StatsAggregator stats, List<LatencyStats> latencies, int intervalSeconds) {
        if (intervalSeconds <= 0) throw new IllegalArgumentException("intervalSeconds must be positive");
        this.stats = stats;
        this.latencies = List.copyOf(latencies);
        this.intervalSeconds = intervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "book-stats-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::report, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Stats reporter started: interval={}s", intervalSeconds);
    }

    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Lifetime totals, logged once on shutdown. */
    public void logShutdownSummary() {
        BookStats s = stats.snapshot();
        log.info("Shutdown summary: placed={} matched={} cancelled={}",
                s.totalPlaced(), s.totalMatched(), s.totalCancelled());
    }

    /** One reporting interval. Package-visible for tests. */
    synchronized BookStats report() {
        try {
            BookStats current = stats.snapshot();
            long dPlaced = current.totalPlaced() - last.totalPlaced();
            long dMatched = current.totalMatched() - last.totalMatched();
            long dCancelled = current.totalCancelled() - last.totalCancelled();
            BookStats delta = new BookStats(dPlaced, dMatched, dCancelled);
            last = current;

            log.info("Book interval={}s placed={} matched={} cancelled={} totals[placed={} matched={} cancelled={}]",
                    intervalSeconds, dPlaced, dMatched, dCancelled,
                    current.totalPlaced(), current.totalMatched(), current.totalCancelled());
            for (LatencyStats l : latencies) {
                l.logAndReset();
            }
            return delta;
        } catch (RuntimeException e) {
            // An exception would cancel the scheduled task
            log.error("Error in periodic stats reporting", e);
            return new BookStats(0, 0, 0);
        }
    }
}

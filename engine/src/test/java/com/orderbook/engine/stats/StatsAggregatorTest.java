package com.orderbook.engine.stats;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatsAggregatorTest {

    @Test
    void testCountersAreIndependent() {
        StatsAggregator stats = new StatsAggregator();
        stats.recordPlaced();
        stats.recordPlaced();
        stats.recordCancelled();
        stats.recordMatched(3);
        stats.recordMatched(0);

        assertEquals(new BookStats(2, 3, 1), stats.snapshot());
    }

    @Test
    void testNegativeMatchCountRejected() {
        StatsAggregator stats = new StatsAggregator();
        assertThrows(IllegalArgumentException.class, () -> stats.recordMatched(-1));
        assertEquals(new BookStats(0, 0, 0), stats.snapshot());
    }

    @Test
    void testReporterLogsDeltasBetweenIntervals() {
        StatsAggregator stats = new StatsAggregator();
        PeriodicStatsReporter reporter = new PeriodicStatsReporter(stats, List.of(), 60);

        stats.recordPlaced();
        stats.recordPlaced();
        assertEquals(new BookStats(2, 0, 0), reporter.report());

        stats.recordPlaced();
        stats.recordMatched(1);
        assertEquals(new BookStats(1, 1, 0), reporter.report(), "second interval only sees new activity");

        reporter.stop();
    }

    @Test
    void testReporterRequiresPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> new PeriodicStatsReporter(new StatsAggregator(), List.of(), 0));
    }
}

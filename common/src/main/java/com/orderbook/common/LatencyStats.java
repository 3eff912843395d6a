package com.orderbook.common;

import org.HdrHistogram.Histogram;
import org.HdrHistogram.Recorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe latency tracking using an HdrHistogram {@link Recorder}.
 * Any number of threads record nanos; one reporter thread drains intervals.
 */
public final class LatencyStats {

    private static final Logger log = LoggerFactory.getLogger(LatencyStats.class);

    private final Recorder recorder;
    private final String name;
    private Histogram interval;

    public LatencyStats(String name) {
        this.name = name;
        // 3 sig figs, auto-resizing
        this.recorder = new Recorder(3);
    }

    public void record(long latencyNanos) {
        recorder.recordValue(Math.max(0, latencyNanos));
    }

    /** Drains everything recorded since the previous call. Single reader only. */
    public synchronized Histogram drain() {
        interval = recorder.getIntervalHistogram(interval);
        return interval;
    }

    /** Logs the interval percentiles and resets. Returns the number of samples logged. */
    public long logAndReset() {
        Histogram h = drain();
        long total = h.getTotalCount();
        if (total == 0) return 0;
        log.info("{} count={} p50={}us p99={}us p999={}us max={}us",
                name, total,
                micros(h.getValueAtPercentile(50)),
                micros(h.getValueAtPercentile(99)),
                micros(h.getValueAtPercentile(99.9)),
                micros(h.getMaxValue()));
        return total;
    }

    public String name() { return name; }

    private static String micros(long nanos) {
        return String.format("%.1f", nanos / 1_000.0);
    }
}

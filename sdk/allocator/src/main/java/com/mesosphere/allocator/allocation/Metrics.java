package com.mesosphere.allocator.allocation;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * This class encapsulates the components necessary for tracking allocator metrics.
 */
public class Metrics {
    private static MetricRegistry metrics = new MetricRegistry();

    public static MetricRegistry getRegistry() {
        return metrics;
    }

    // Passes

    static final String ALLOCATION_RUNS = "allocation.runs";
    static final String ALLOCATION_RUN = "allocation.run";
    static final String SKIPPED_PAUSED = "allocation.skipped_paused";

    public static void incrementAllocationRuns() {
        metrics.counter(ALLOCATION_RUNS).inc();
    }

    public static void incrementSkippedPaused() {
        metrics.counter(SKIPPED_PAUSED).inc();
    }

    /**
     * Returns a timer context which may be used to measure the time spent in an allocation pass. The returned timer
     * must be terminated by invoking {@link Timer.Context#stop()}.
     */
    public static Timer.Context getAllocationRunTimer() {
        return metrics.timer(ALLOCATION_RUN).time();
    }

    // Offers

    static final String OFFERS = "allocation.offers";
    static final String CALLBACK_FAILURES = "allocation.callback_failures";

    public static void incrementOffers(long amount) {
        metrics.counter(OFFERS).inc(amount);
    }

    public static void incrementCallbackFailures() {
        metrics.counter(CALLBACK_FAILURES).inc();
    }
}

package com.phillippitts.actiontracker.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the tracker itself.
 *
 * <p>Provides:
 * <ul>
 *   <li>Flush outcomes (rendered, ignored, inactive)</li>
 *   <li>Accumulation latency and failures per file format</li>
 *   <li>Units of work that replaced a stale context</li>
 * </ul>
 *
 * <p>Action labels are deliberately not used as tags to keep cardinality bounded.
 */
public class TrackerMetrics {

    private static final String METRIC_PREFIX = "action.tracker";

    private final MeterRegistry registry;

    public TrackerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome {@code rendered}, {@code ignored} or {@code inactive}
     */
    public void incrementFlush(String outcome) {
        Counter.builder(METRIC_PREFIX + ".flush")
                .description("Number of flushes by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAccumulation(String format, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".accumulation.latency")
                .description("Time spent merging a summary into the accumulation file")
                .tag("format", format)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementAccumulationFailure(String format) {
        Counter.builder(METRIC_PREFIX + ".accumulation.failure")
                .description("Number of failed accumulation file updates")
                .tag("format", format)
                .register(registry)
                .increment();
    }

    public void incrementStaleContext() {
        Counter.builder(METRIC_PREFIX + ".context.stale")
                .description("Number of begin calls that replaced a context never ended")
                .register(registry)
                .increment();
    }
}

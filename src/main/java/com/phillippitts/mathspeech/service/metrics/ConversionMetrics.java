package com.phillippitts.mathspeech.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer instrumentation for conversions.
 *
 * <p>Provides:
 * <ul>
 *   <li>Conversion latency per domain</li>
 *   <li>Success and failure counts, failures tagged by error kind</li>
 *   <li>Cache hit and miss counts, and a cache size gauge</li>
 *   <li>Unmatched expression count</li>
 * </ul>
 */
@Component
public class ConversionMetrics {

    private static final String METRIC_PREFIX = "mathspeech.conversion";

    private final MeterRegistry registry;

    public ConversionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param domain        domain tag used for rule selection
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String domain, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to convert an expression")
                .tag("domain", domain)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(boolean cacheHit) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful conversions")
                .tag("cache", cacheHit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure kind (validation, complexity, timeout, error)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed conversions")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementNoMatch() {
        Counter.builder(METRIC_PREFIX + ".unmatched")
                .description("Number of expressions no rule matched")
                .register(registry)
                .increment();
    }

    /**
     * Registers a gauge reporting the current cache size.
     */
    public void registerCacheSize(Supplier<Number> size) {
        Gauge.builder(METRIC_PREFIX + ".cache.size", size)
                .description("Number of cached conversion results")
                .register(registry);
    }
}

package com.phillippitts.summarizer.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for summary generation.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Backend call latency per backend (bundled, ollama, cloud)</li>
 *   <li>Success/failure counts per backend, failures tagged with a coarse reason</li>
 *   <li>Asset download outcomes per asset id</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class InferenceMetrics {

    private static final String METRIC_PREFIX = "summarizer.inference";

    private final MeterRegistry registry;

    public InferenceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency of a backend call.
     *
     * @param backend backend id (bundled, ollama, cloud)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String backend, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time spent waiting for the generation backend")
                .tag("backend", backend)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String backend) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of generated summaries")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    /**
     * @param reason coarse failure class (timeout, network, status, configuration, error, ...)
     */
    public void incrementFailure(String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed summary generations")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome success or the failing exception's simple name
     */
    public void recordDownload(String assetId, String outcome) {
        Counter.builder("summarizer.asset.download")
                .description("Asset download attempts by outcome")
                .tag("asset", assetId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}

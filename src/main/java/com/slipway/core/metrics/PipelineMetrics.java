package com.slipway.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStage(String stage, String state, long ms) {
        Timer.builder("slipway.stage.duration")
                .tag("stage", stage)
                .tag("state", state)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAttempts(String stage, int attempts) {
        DistributionSummary.builder("slipway.stage.attempts")
                .tag("stage", stage)
                .register(registry)
                .record(attempts);
    }

    public void recordRunResult(String status) {
        Counter.builder("slipway.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records environment lifecycle operations. Acquire and release counts should match
     * once all runs are terminal; a gap means a leaked container.
     *
     * @param operation "acquire" or "release"
     */
    public void recordEnvironment(String operation) {
        Counter.builder("slipway.environments")
                .description("Stage environment lifecycle operations")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void incrementRetries(String stage, String errorType) {
        Counter.builder("slipway.stage.retries")
                .tag("stage", stage)
                .tag("error", errorType)
                .register(registry)
                .increment();
    }

    /** Live count of environments acquired and not yet released. */
    public void gaugeActiveEnvironments(Supplier<Number> activeCount) {
        Gauge.builder("slipway.environments.active", activeCount)
                .description("Stage environments currently alive")
                .register(registry);
    }
}

package com.bank.bakeoff.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBakeoffStarted(String executionMode) {
        Counter.builder("bakeoff.started.count")
                .tag("mode", executionMode)
                .register(registry)
                .increment();
    }

    public void recordBakeoffFinished(String status) {
        Counter.builder("bakeoff.finished.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCandidateTrained(String algorithm, boolean failed, long durationMs) {
        Counter.builder("bakeoff.candidate.count")
                .tag("algorithm", algorithm)
                .tag("outcome", failed ? "failed" : "trained")
                .register(registry)
                .increment();

        Timer.builder("bakeoff.candidate.training_time")
                .tag("algorithm", algorithm)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordScoringRun(String status) {
        Counter.builder("scoring.run.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordFlagged(int flaggedCount, int rowCount) {
        DistributionSummary.builder("scoring.flagged_rows")
                .register(registry)
                .record(flaggedCount);

        DistributionSummary.builder("scoring.scored_rows")
                .register(registry)
                .record(rowCount);
    }
}

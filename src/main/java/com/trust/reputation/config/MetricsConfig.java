package com.trust.reputation.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastSybilCandidateCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastSybilCandidateCount = registry.gauge("reputation.sybil.candidates.last", new AtomicInteger(0));
    }

    public void recordScoringRun(boolean converged, int iterations, int nodeCount) {
        Counter.builder("reputation.scoring.count")
                .tag("converged", String.valueOf(converged))
                .register(registry)
                .increment();

        DistributionSummary.builder("reputation.pagerank.iterations")
                .register(registry)
                .record(iterations);

        DistributionSummary.builder("reputation.scoring.nodes")
                .register(registry)
                .record(nodeCount);
    }

    public void recordSybilCandidates(int count) {
        Counter.builder("reputation.sybil.candidates.count")
                .register(registry)
                .increment(count);
        lastSybilCandidateCount.set(count);
    }

    public void recordClusteringRun(String method, int clusterCount, int highRiskCount) {
        Counter.builder("clustering.run.count")
                .tag("method", method)
                .register(registry)
                .increment();

        DistributionSummary.builder("clustering.clusters")
                .tag("method", method)
                .register(registry)
                .record(clusterCount);

        Counter.builder("clustering.high_risk.count")
                .tag("method", method)
                .register(registry)
                .increment(highRiskCount);
    }

    public void recordTuningRun(int evaluatedSteps) {
        DistributionSummary.builder("clustering.tuning.steps")
                .register(registry)
                .record(evaluatedSteps);
    }

    public void recordValidationFailure(String component) {
        Counter.builder("validation.failure.count")
                .tag("component", component)
                .register(registry)
                .increment();
    }
}

package com.trust.reputation.service;

import com.trust.reputation.config.MetricsConfig;
import com.trust.reputation.config.ReputationProperties;
import com.trust.reputation.engine.clustering.ClusterAssembler;
import com.trust.reputation.model.AccountAttributes;
import com.trust.reputation.model.Cluster;
import com.trust.reputation.model.PipelineRequest;
import com.trust.reputation.model.PipelineResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.trust.reputation.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class TrustPipelineServiceTest {

    private TrustPipelineService pipeline;

    @BeforeEach
    void setUp() {
        ReputationProperties properties = new ReputationProperties();
        MetricsConfig metrics = new MetricsConfig(new SimpleMeterRegistry());
        pipeline = new TrustPipelineService(
                new ReputationService(properties, metrics),
                new ClusteringService(properties, metrics, Tracer.NOOP),
                new AccountAssembler());
    }

    @Test
    void analyze_sybilRing_isTheRiskiestCluster() {
        Map<String, AccountAttributes> raw = new HashMap<>();
        for (int i = 0; i < 10; i++) {
            raw.put(sybilId(i), AccountAttributes.builder().emailDomain(SYBIL_DOMAIN).build());
        }

        PipelineResult result = pipeline.analyze(PipelineRequest.builder()
                .graph(sybilRingGraph(10, 10))
                .accountAttributes(raw)
                .build());

        assertThat(result.getReputation().getScores()).hasSize(20);
        Cluster riskiest = result.getClusters().stream()
                .max((x, y) -> Double.compare(x.getRiskScore(), y.getRiskScore()))
                .orElseThrow();
        assertThat(riskiest.getAccounts()).containsExactlyElementsOf(sybilIds().subList(0, 10));
        assertThat(riskiest.getPatterns()).contains(
                ClusterAssembler.SHARED_EMAIL_DOMAIN,
                ClusterAssembler.TIGHTLY_KNIT,
                ClusterAssembler.SYBIL_SIGNALS);
        assertThat(result.getClusters()).allSatisfy(cluster -> {
            if (cluster != riskiest) {
                assertThat(cluster.getRiskScore()).isLessThan(riskiest.getRiskScore());
            }
        });
    }

    @Test
    void analyze_emptyGraph_producesNoClusters() {
        PipelineResult result = pipeline.analyze(PipelineRequest.builder()
                .graph(snapshot(List.of(), List.of()))
                .build());

        assertThat(result.getReputation().getScores()).isEmpty();
        assertThat(result.getClusters()).isEmpty();
    }
}

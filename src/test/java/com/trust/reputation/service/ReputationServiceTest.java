package com.trust.reputation.service;

import com.trust.reputation.config.MetricsConfig;
import com.trust.reputation.config.ReputationProperties;
import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.engine.graph.InputValidationException;
import com.trust.reputation.model.ReputationRequest;
import com.trust.reputation.model.ReputationResult;
import com.trust.reputation.model.ReputationScore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.trust.reputation.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ReputationServiceTest {

    private SimpleMeterRegistry registry;
    private ReputationProperties properties;
    private ReputationService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new ReputationProperties();
        service = new ReputationService(properties, new MetricsConfig(registry));
    }

    @Test
    void compute_noOverride_usesServerDefaultsAndRecordsRun() {
        ReputationResult result = service.compute(ReputationRequest.builder().graph(triangleRing()).build());

        assertThat(result.getScores()).containsOnlyKeys("A", "B", "C");
        assertThat(registry.get("reputation.scoring.count").tag("converged", "true").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("reputation.scoring.nodes").summary().totalAmount()).isEqualTo(3.0);
    }

    @Test
    void compute_requestConfigOverridesDefaults() {
        ScoringConfig override = new ScoringConfig();
        override.setEnableHybridScoring(false);

        ReputationResult result = service.compute(ReputationRequest.builder()
                .graph(triangleRing())
                .config(override)
                .build());

        ReputationScore a = result.getScores().get("A");
        assertThat(a.getFinalScore()).isEqualTo(a.getGraphScore());
        assertThat(properties.getScoring().isEnableHybridScoring()).isTrue();
    }

    @Test
    void compute_withHistory_smoothsKnownNodesOnly() {
        ReputationResult result = service.compute(ReputationRequest.builder()
                .graph(triangleRing())
                .scoreHistory(Map.of("A", List.of(10.0), "ghost", List.of(1.0)))
                .smoothingWindow(2)
                .smoothingDecay(0.5)
                .build());

        ReputationScore a = result.getScores().get("A");
        assertThat(a.getSmoothedScore()).isCloseTo((a.getFinalScore() + 0.5 * 10.0) / 1.5, within(1e-9));
        assertThat(result.getScores().get("B").getSmoothedScore()).isNull();
    }

    @Test
    void compute_withoutHistory_leavesSmoothedScoreEmpty() {
        ReputationResult result = service.compute(ReputationRequest.builder().graph(triangleRing()).build());

        assertThat(result.getScores().values()).allMatch(score -> score.getSmoothedScore() == null);
    }

    @Test
    void compute_invalidSmoothingDecay_rejected() {
        ReputationRequest request = ReputationRequest.builder()
                .graph(triangleRing())
                .scoreHistory(Map.of("A", List.of(10.0)))
                .smoothingDecay(0.0)
                .build();

        assertThatThrownBy(() -> service.compute(request))
                .isInstanceOf(InputValidationException.class)
                .hasFieldOrPropertyWithValue("field", "smoothingDecay");
    }

    @Test
    void compute_nonFiniteOrNegativeHistoryEntry_rejected() {
        ReputationRequest nan = ReputationRequest.builder()
                .graph(triangleRing())
                .scoreHistory(Map.of("A", List.of(10.0, Double.NaN)))
                .build();
        ReputationRequest negative = ReputationRequest.builder()
                .graph(triangleRing())
                .scoreHistory(Map.of("B", List.of(-5.0)))
                .build();

        assertThatThrownBy(() -> service.compute(nan))
                .isInstanceOf(InputValidationException.class)
                .hasFieldOrPropertyWithValue("subject", "A")
                .hasFieldOrPropertyWithValue("field", "scoreHistory");
        assertThatThrownBy(() -> service.compute(negative))
                .hasFieldOrPropertyWithValue("subject", "B");
        assertThat(registry.get("validation.failure.count").tag("component", "scoring").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void compute_invalidGraph_recordsValidationFailureAndRethrows() {
        ReputationRequest request = ReputationRequest.builder()
                .graph(snapshot(List.of(node("A")), List.of(edge("A", "missing"))))
                .build();

        assertThatThrownBy(() -> service.compute(request)).isInstanceOf(InputValidationException.class);
        assertThat(registry.get("validation.failure.count").tag("component", "scoring").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("reputation.scoring.count").counter()).isNull();
    }

    @Test
    void compute_sybilRing_publishesCandidateCount() {
        service.compute(ReputationRequest.builder().graph(sybilRingGraph(10, 10)).build());

        assertThat(registry.get("reputation.sybil.candidates.last").gauge().value()).isEqualTo(10.0);
        assertThat(registry.get("reputation.sybil.candidates.count").counter().count()).isEqualTo(10.0);
    }
}

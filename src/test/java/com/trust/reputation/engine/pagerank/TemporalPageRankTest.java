package com.trust.reputation.engine.pagerank;

import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.engine.graph.IndexedGraph;
import com.trust.reputation.model.GraphSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.trust.reputation.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TemporalPageRankTest {

    private ScoringConfig config;

    @BeforeEach
    void setUp() {
        config = new ScoringConfig();
    }

    @Test
    void compute_ranksSumToOne() {
        IndexedGraph graph = IndexedGraph.build(randomGraph(40, 150, 7L), config);

        PageRankResult result = new TemporalPageRank(config).compute(graph, uniform(graph.nodeCount()));

        assertThat(Arrays.stream(result.getRanks()).sum()).isCloseTo(1.0, within(1e-9));
        assertThat(result.isConverged()).isTrue();
        assertThat(result.getFinalDelta()).isLessThan(config.getTolerance());
    }

    @Test
    void compute_symmetricRing_givesEqualRanks() {
        IndexedGraph graph = IndexedGraph.build(triangleRing(), config);

        double[] ranks = new TemporalPageRank(config).compute(graph, uniform(3)).getRanks();

        assertThat(ranks[0]).isEqualTo(ranks[1]).isEqualTo(ranks[2]);
        assertThat(ranks[0]).isCloseTo(1.0 / 3, within(1e-9));
    }

    @Test
    void compute_danglingNodesKeepMassConserved() {
        GraphSnapshot snapshot = snapshot(List.of(node("A"), node("B"), node("C")),
                List.of(edge("A", "B"), edge("A", "C")));
        IndexedGraph graph = IndexedGraph.build(snapshot, config);

        double[] ranks = new TemporalPageRank(config).compute(graph, uniform(3)).getRanks();

        assertThat(Arrays.stream(ranks).sum()).isCloseTo(1.0, within(1e-9));
        assertThat(ranks[1]).isGreaterThan(ranks[0]);
        assertThat(ranks[1]).isCloseTo(ranks[2], within(1e-12));
    }

    @Test
    void compute_iterationCapReached_reportsNotConverged() {
        config.setMaxIterations(1);
        config.setTolerance(0.0);
        IndexedGraph graph = IndexedGraph.build(randomGraph(20, 60, 3L), config);

        PageRankResult result = new TemporalPageRank(config).compute(graph, uniform(graph.nodeCount()));

        assertThat(result.isConverged()).isFalse();
        assertThat(result.getIterations()).isEqualTo(1);
        assertThat(Arrays.stream(result.getRanks()).sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void compute_excludingOnlyIncomingEdge_lowersTargetRank() {
        GraphSnapshot snapshot = snapshot(List.of(node("A"), node("B"), node("C")),
                List.of(edge("A", "B"), edge("B", "C"), edge("C", "A")));
        IndexedGraph graph = IndexedGraph.build(snapshot, config);
        TemporalPageRank pageRank = new TemporalPageRank(config);

        double base = pageRank.compute(graph, uniform(3)).getRanks()[1];
        double without = pageRank.compute(graph, uniform(3), 0).getRanks()[1];

        assertThat(without).isLessThan(base);
    }

    @Test
    void compute_emptyGraph_convergedWithNoRanks() {
        IndexedGraph graph = IndexedGraph.build(snapshot(List.of(), List.of()), config);

        PageRankResult result = new TemporalPageRank(config).compute(graph, new double[0]);

        assertThat(result.getRanks()).isEmpty();
        assertThat(result.isConverged()).isTrue();
    }

    @Test
    void economicallyBiasedTeleport_favoursCommittedNodes() {
        double[] teleport = TeleportVector.economicallyBiased(new double[]{0.0, 1.0}, 1.0);

        assertThat(teleport[0]).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(teleport[1]).isCloseTo(2.0 / 3, within(1e-12));
        assertThat(TeleportVector.economicallyBiased(new double[]{0.0, 1.0}, 0.0)).containsExactly(0.5, 0.5);
    }

    private static double[] uniform(int n) {
        double[] p = new double[n];
        Arrays.fill(p, 1.0 / n);
        return p;
    }
}

package com.trust.reputation.engine.scoring;

import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.engine.graph.IndexedGraph;
import com.trust.reputation.model.EdgeType;
import com.trust.reputation.model.GraphEdge;
import com.trust.reputation.model.GraphNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.trust.reputation.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DeceptiveEdgeDetectorTest {

    private ScoringConfig config;

    @BeforeEach
    void setUp() {
        config = new ScoringConfig();
    }

    @Test
    void detect_flagsSelfPromotionAndCoordinatedBadMouthing() {
        List<GraphNode> nodes = List.of(node("p0"), node("p1"), node("p2"),
                node("x0"), node("x1"), node("x2"), node("v"));
        List<GraphEdge> edges = List.of(
                typed("p0", "p1", 0.9, EdgeType.ENDORSE),
                typed("x0", "v", 0.1, EdgeType.ENDORSE),
                typed("x1", "v", 0.1, EdgeType.REVIEW),
                typed("x2", "v", 0.1, EdgeType.ENDORSE),
                typed("p1", "p2", 0.9, EdgeType.PAYMENT),
                typed("p2", "v", 0.5, EdgeType.ENDORSE));
        IndexedGraph graph = IndexedGraph.build(snapshot(nodes, edges), config);
        int[] communities = {0, 0, 0, 3, 3, 3, 6};

        Map<String, Double> result = new DeceptiveEdgeDetector().detect(graph, communities);

        assertThat(result).containsOnlyKeys("p0->p1#0", "x0->v#1", "x1->v#2", "x2->v#3");
        assertThat(result.get("p0->p1#0")).isCloseTo(0.4, within(1e-12));
        assertThat(result.get("x1->v#2")).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void detect_twoLowEdgesAreNotCoordinated() {
        List<GraphNode> nodes = List.of(node("x0"), node("x1"), node("v"));
        List<GraphEdge> edges = List.of(
                typed("x0", "v", 0.1, EdgeType.ENDORSE),
                typed("x1", "v", 0.1, EdgeType.ENDORSE));
        IndexedGraph graph = IndexedGraph.build(snapshot(nodes, edges), config);

        assertThat(new DeceptiveEdgeDetector().detect(graph, new int[]{0, 0, 2})).isEmpty();
    }

    @Test
    void communityDetector_separatesDisconnectedTriangles() {
        List<GraphNode> nodes = List.of(node("a"), node("b"), node("c"), node("d"), node("e"), node("f"));
        List<GraphEdge> edges = List.of(
                edge("a", "b"), edge("b", "c"), edge("c", "a"),
                edge("d", "e"), edge("e", "f"), edge("f", "d"));
        IndexedGraph graph = IndexedGraph.build(snapshot(nodes, edges), config);

        int[] labels = new CommunityDetector().detect(graph);

        assertThat(labels[1]).isEqualTo(labels[0]);
        assertThat(labels[2]).isEqualTo(labels[0]);
        assertThat(labels[4]).isEqualTo(labels[3]);
        assertThat(labels[5]).isEqualTo(labels[3]);
        assertThat(labels[0]).isNotEqualTo(labels[3]);
        assertThat(CommunityDetector.communitySizes(labels)[labels[0]]).isEqualTo(3);
    }

    @Test
    void communityDetector_isolatedNodeKeepsOwnLabel() {
        IndexedGraph graph = IndexedGraph.build(snapshot(List.of(node("a"), node("b")), List.of()), config);

        assertThat(new CommunityDetector().detect(graph)).containsExactly(0, 1);
    }

    private static GraphEdge typed(String source, String target, double weight, EdgeType type) {
        return GraphEdge.builder()
                .source(source).target(target).weight(weight).edgeType(type).timestamp(BASE_TIME).build();
    }
}

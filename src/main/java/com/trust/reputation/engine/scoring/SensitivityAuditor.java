package com.trust.reputation.engine.scoring;

import com.trust.reputation.engine.graph.IndexedGraph;
import com.trust.reputation.engine.pagerank.PageRankResult;
import com.trust.reputation.engine.pagerank.TemporalPageRank;
import com.trust.reputation.model.EdgeImpact;
import com.trust.reputation.model.SensitivityAudit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Leave-one-out edge influence. Each audited edge costs one extra PageRank run, so
 * callers bound the audited node set. Effective weights, including decay measured
 * from the full snapshot's newest edge, are reused unchanged.
 */
public class SensitivityAuditor {

    private final TemporalPageRank pageRank;
    private final Function<double[], double[]> graphScores;
    private final boolean includeOutgoing;
    private final int topK;

    /**
     * @param graphScores maps raw ranks to graph scores, applying the same post-processing
     *                    as the base run
     */
    public SensitivityAuditor(TemporalPageRank pageRank, Function<double[], double[]> graphScores,
                              boolean includeOutgoing, int topK) {
        this.pageRank = pageRank;
        this.graphScores = graphScores;
        this.includeOutgoing = includeOutgoing;
        this.topK = topK;
    }

    public SensitivityAudit audit(IndexedGraph graph, double[] teleport, int node, double baseScore) {
        TreeSet<Integer> edgeIndices = new TreeSet<>();
        for (int e : graph.incoming(node)) {
            edgeIndices.add(e);
        }
        if (includeOutgoing) {
            for (int e : graph.outgoing(node)) {
                edgeIndices.add(e);
            }
        }

        List<EdgeImpact> impacts = new ArrayList<>(edgeIndices.size());
        for (int e : edgeIndices) {
            PageRankResult without = pageRank.compute(graph, teleport, e);
            double score = graphScores.apply(without.getRanks())[node];
            double impact = score - baseScore;
            impacts.add(EdgeImpact.builder()
                    .edgeIndex(e)
                    .source(graph.nodeId(graph.source(e)))
                    .target(graph.nodeId(graph.target(e)))
                    .impact(impact)
                    .relativeImpact(baseScore != 0.0 ? impact / baseScore * 100.0 : 0.0)
                    .build());
        }
        impacts.sort(Comparator.<EdgeImpact>comparingDouble(i -> -Math.abs(i.getImpact()))
                .thenComparingInt(EdgeImpact::getEdgeIndex));

        return SensitivityAudit.builder()
                .nodeId(graph.nodeId(node))
                .baseScore(baseScore)
                .edgeSensitivity(impacts)
                .topInfluencingEdges(new ArrayList<>(impacts.subList(0, Math.min(topK, impacts.size()))))
                .build();
    }
}

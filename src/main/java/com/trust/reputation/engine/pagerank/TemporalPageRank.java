package com.trust.reputation.engine.pagerank;

import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.engine.graph.IndexedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Weighted power-iteration PageRank over decayed, boosted edge weights.
 * Dangling mass and the (1 - d) restart both follow the teleport vector.
 */
public class TemporalPageRank {

    public static final String ALGORITHM = "TemporalWeightedPageRank";
    public static final int NO_EXCLUSION = -1;

    private static final Logger log = LoggerFactory.getLogger(TemporalPageRank.class);

    private final double damping;
    private final int maxIterations;
    private final double tolerance;

    public TemporalPageRank(ScoringConfig config) {
        this.damping = config.getDampingFactor();
        this.maxIterations = config.getMaxIterations();
        this.tolerance = config.getTolerance();
    }

    public PageRankResult compute(IndexedGraph graph, double[] teleport) {
        return compute(graph, teleport, NO_EXCLUSION);
    }

    /**
     * @param excludedEdge edge index treated as absent, or {@link #NO_EXCLUSION}
     */
    public PageRankResult compute(IndexedGraph graph, double[] teleport, int excludedEdge) {
        int n = graph.nodeCount();
        if (n == 0) {
            return new PageRankResult(new double[0], 0, true, 0.0);
        }
        int m = graph.edgeCount();

        double[] outSum = new double[n];
        for (int e = 0; e < m; e++) {
            if (e != excludedEdge) {
                outSum[graph.source(e)] += graph.weight(e);
            }
        }

        double[] rank = new double[n];
        Arrays.fill(rank, 1.0 / n);
        double delta = Double.MAX_VALUE;
        int iteration = 0;
        boolean converged = false;

        while (iteration < maxIterations) {
            iteration++;
            double dangling = 0.0;
            for (int i = 0; i < n; i++) {
                if (outSum[i] <= 0.0) {
                    dangling += rank[i];
                }
            }

            double[] next = new double[n];
            for (int e = 0; e < m; e++) {
                if (e == excludedEdge) {
                    continue;
                }
                int s = graph.source(e);
                if (outSum[s] > 0.0) {
                    next[graph.target(e)] += damping * rank[s] * graph.weight(e) / outSum[s];
                }
            }

            double restart = (1.0 - damping) + damping * dangling;
            delta = 0.0;
            for (int i = 0; i < n; i++) {
                next[i] += restart * teleport[i];
                delta += Math.abs(next[i] - rank[i]);
            }
            rank = next;

            if (delta < tolerance) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log.warn("PageRank did not converge after {} iterations (delta={}, tolerance={})",
                    iteration, delta, tolerance);
        } else {
            log.debug("PageRank converged after {} iterations (delta={})", iteration, delta);
        }
        return new PageRankResult(rank, iteration, converged, delta);
    }
}

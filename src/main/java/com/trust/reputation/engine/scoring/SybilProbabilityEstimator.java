package com.trust.reputation.engine.scoring;

import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.engine.graph.IndexedGraph;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Weighted sum of four structural and economic signals, clamped to [0, 1].
 * <p>
 * The output ranks nodes by how Sybil-like their neighborhood looks. It is not a
 * verdict: callers need a separate policy threshold before acting on it.
 */
public class SybilProbabilityEstimator {

    private static final double FAN_OUT_SATURATION = 10.0;

    private final ScoringConfig.SybilWeights weights;
    private final long recentWindowMs;

    public SybilProbabilityEstimator(ScoringConfig config) {
        this.weights = config.getSybilWeights();
        this.recentWindowMs = config.getRecentWindowMs();
    }

    /**
     * @param economicSignal per-node stake/payment signal in [0, 1]
     */
    public double[] estimate(IndexedGraph graph, double[] economicSignal) {
        int n = graph.nodeCount();
        double[] clustering = clusteringCoefficients(graph);
        double[] burst = recentBurst(graph);

        int maxIn = 0;
        for (int i = 0; i < n; i++) {
            maxIn = Math.max(maxIn, graph.incoming(i).length);
        }

        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            int in = graph.incoming(i).length;
            int out = graph.outgoing(i).length;

            double endorsementVolume = maxIn > 0 ? Math.log1p(in) / Math.log1p(maxIn) : 0.0;
            double mismatch = endorsementVolume * (1.0 - economicSignal[i]);

            double fanOut = 0.0;
            if (out > 0) {
                fanOut = Math.min(1.0, out / FAN_OUT_SATURATION) * Math.max(0.0, 1.0 - (double) in / out);
            }

            double p = weights.getClusteringCoefficient() * clustering[i]
                    + weights.getRecentBurst() * burst[i]
                    + weights.getEconomicMismatch() * mismatch
                    + weights.getFanOutSpam() * fanOut;
            result[i] = Math.max(0.0, Math.min(1.0, p));
        }
        return result;
    }

    // Local clustering coefficient over the undirected, de-duplicated neighbor sets
    double[] clusteringCoefficients(IndexedGraph graph) {
        int n = graph.nodeCount();
        @SuppressWarnings("unchecked")
        Set<Integer>[] neighbors = new Set[n];
        for (int i = 0; i < n; i++) {
            neighbors[i] = new HashSet<>();
        }
        for (int e = 0; e < graph.edgeCount(); e++) {
            int s = graph.source(e);
            int t = graph.target(e);
            if (s != t) {
                neighbors[s].add(t);
                neighbors[t].add(s);
            }
        }

        double[] coefficients = new double[n];
        for (int i = 0; i < n; i++) {
            int k = neighbors[i].size();
            if (k < 2) {
                continue;
            }
            int[] adjacent = neighbors[i].stream().mapToInt(Integer::intValue).sorted().toArray();
            int links = 0;
            for (int a = 0; a < adjacent.length; a++) {
                for (int b = a + 1; b < adjacent.length; b++) {
                    if (neighbors[adjacent[a]].contains(adjacent[b])) {
                        links++;
                    }
                }
            }
            coefficients[i] = links / (k * (k - 1) / 2.0);
        }
        return coefficients;
    }

    // Share of a node's recent incident edges above the graph-wide recent share
    double[] recentBurst(IndexedGraph graph) {
        int n = graph.nodeCount();
        int m = graph.edgeCount();
        double[] burst = new double[n];
        if (m == 0) {
            return burst;
        }
        long cutoff = graph.referenceTime() - recentWindowMs;
        boolean[] recent = new boolean[m];
        int recentTotal = 0;
        for (int e = 0; e < m; e++) {
            recent[e] = graph.edge(e).getTimestamp() >= cutoff;
            if (recent[e]) recentTotal++;
        }
        double baseline = (double) recentTotal / m;
        if (baseline >= 1.0) {
            return burst;
        }

        for (int i = 0; i < n; i++) {
            int[] in = graph.incoming(i);
            int[] out = graph.outgoing(i);
            int incident = in.length + out.length;
            if (incident == 0) {
                continue;
            }
            long recentIncident = Arrays.stream(in).filter(e -> recent[e]).count()
                    + Arrays.stream(out).filter(e -> recent[e]).count();
            double share = (double) recentIncident / incident;
            burst[i] = Math.max(0.0, Math.min(1.0, (share - baseline) / (1.0 - baseline)));
        }
        return burst;
    }
}

package com.trust.reputation.engine.scoring;

import com.trust.reputation.engine.graph.IndexedGraph;
import com.trust.reputation.model.EdgeType;
import com.trust.reputation.model.GraphEdge;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores ENDORSE and REVIEW edges for three manipulation patterns: self-promotion
 * inside a small community, coordinated bad-mouthing from another community and
 * bursts from a single source. Edges matching no pattern are omitted.
 */
public class DeceptiveEdgeDetector {

    static final int MIN_PROMOTION_COMMUNITY = 3;
    static final int MAX_PROMOTION_COMMUNITY = 20;
    static final double PROMOTION_WEIGHT = 0.8;
    static final double BAD_MOUTH_WEIGHT = 0.2;
    static final double LOW_WEIGHT = 0.3;
    static final int MIN_COORDINATED_LOW_EDGES = 3;
    static final int BURST_EDGE_COUNT = 10;
    static final long BURST_WINDOW_MS = 24L * 60 * 60 * 1000;

    public Map<String, Double> detect(IndexedGraph graph, int[] communities) {
        int[] sizes = CommunityDetector.communitySizes(communities);
        int m = graph.edgeCount();

        // (source community, target node) -> low-weight edge count
        Map<Long, Integer> lowWeightEdges = new HashMap<>();
        for (int e = 0; e < m; e++) {
            if (graph.edge(e).getWeight() < LOW_WEIGHT) {
                lowWeightEdges.merge(communityTargetKey(communities[graph.source(e)], graph.target(e)), 1,
                        Integer::sum);
            }
        }

        long[][] sourceTimestamps = new long[graph.nodeCount()][];
        for (int i = 0; i < graph.nodeCount(); i++) {
            int[] out = graph.outgoing(i);
            long[] ts = new long[out.length];
            for (int k = 0; k < out.length; k++) {
                ts[k] = graph.edge(out[k]).getTimestamp();
            }
            Arrays.sort(ts);
            sourceTimestamps[i] = ts;
        }

        Map<String, Double> result = new LinkedHashMap<>();
        for (int e = 0; e < m; e++) {
            GraphEdge edge = graph.edge(e);
            if (edge.getEdgeType() != EdgeType.ENDORSE && edge.getEdgeType() != EdgeType.REVIEW) {
                continue;
            }
            int s = graph.source(e);
            int t = graph.target(e);
            double probability = 0.0;

            if (communities[s] == communities[t]) {
                int size = sizes[communities[s]];
                if (size >= MIN_PROMOTION_COMMUNITY && size <= MAX_PROMOTION_COMMUNITY
                        && edge.getWeight() > PROMOTION_WEIGHT) {
                    probability += 0.4;
                }
            } else if (edge.getWeight() < BAD_MOUTH_WEIGHT) {
                int coordinated = lowWeightEdges.getOrDefault(communityTargetKey(communities[s], t), 0);
                if (coordinated >= MIN_COORDINATED_LOW_EDGES) {
                    probability += 0.5;
                }
            }

            int nearby = countWithin(sourceTimestamps[s], edge.getTimestamp() - BURST_WINDOW_MS,
                    edge.getTimestamp() + BURST_WINDOW_MS) - 1;
            if (nearby > BURST_EDGE_COUNT) {
                probability += 0.3;
            }

            if (probability > 0.0) {
                result.put(edgeKey(edge, e), Math.min(1.0, probability));
            }
        }
        return result;
    }

    public static String edgeKey(GraphEdge edge, int index) {
        return edge.getSource() + "->" + edge.getTarget() + "#" + index;
    }

    private static long communityTargetKey(int community, int target) {
        return ((long) community << 32) | (target & 0xffffffffL);
    }

    // Count of sorted values in [from, to]
    private static int countWithin(long[] sorted, long from, long to) {
        return lowerBound(sorted, to + 1) - lowerBound(sorted, from);
    }

    private static int lowerBound(long[] sorted, long key) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}

package com.trust.reputation.engine.scoring;

import com.trust.reputation.engine.graph.IndexedGraph;

import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic label propagation over the undirected, effective-weight view of the
 * graph. Nodes are visited in input order and weight ties go to the smallest label.
 */
public class CommunityDetector {

    static final int MAX_SWEEPS = 10;

    public int[] detect(IndexedGraph graph) {
        int n = graph.nodeCount();
        int[] labels = new int[n];
        for (int i = 0; i < n; i++) {
            labels[i] = i;
        }

        for (int sweep = 0; sweep < MAX_SWEEPS; sweep++) {
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                Map<Integer, Double> labelWeight = new TreeMap<>();
                for (int e : graph.incoming(i)) {
                    int other = graph.source(e);
                    if (other != i) labelWeight.merge(labels[other], graph.weight(e), Double::sum);
                }
                for (int e : graph.outgoing(i)) {
                    int other = graph.target(e);
                    if (other != i) labelWeight.merge(labels[other], graph.weight(e), Double::sum);
                }
                if (labelWeight.isEmpty()) {
                    continue;
                }
                int best = labels[i];
                double bestWeight = -1.0;
                for (Map.Entry<Integer, Double> entry : labelWeight.entrySet()) {
                    if (entry.getValue() > bestWeight) {
                        best = entry.getKey();
                        bestWeight = entry.getValue();
                    }
                }
                if (best != labels[i]) {
                    labels[i] = best;
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
        }
        return labels;
    }

    public static int[] communitySizes(int[] labels) {
        int[] sizes = new int[labels.length];
        for (int label : labels) {
            sizes[label]++;
        }
        return sizes;
    }
}

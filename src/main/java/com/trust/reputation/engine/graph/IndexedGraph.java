package com.trust.reputation.engine.graph;

import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.model.GraphEdge;
import com.trust.reputation.model.GraphNode;
import com.trust.reputation.model.GraphSnapshot;
import com.trust.reputation.model.NodeAttributes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense, index-addressed view of a validated snapshot. Nodes keep input order and
 * edges keep their input index, so every traversal is deterministic.
 */
public final class IndexedGraph {

    private final List<String> nodeIds;
    private final Map<String, Integer> indexById;
    private final NodeAttributes[] attributes;
    private final List<GraphEdge> edges;
    private final int[] edgeSource;
    private final int[] edgeTarget;
    private final double[] edgeWeight;
    private final int[][] incoming;
    private final int[][] outgoing;
    private final long referenceTime;

    private IndexedGraph(List<String> nodeIds, Map<String, Integer> indexById, NodeAttributes[] attributes,
                         List<GraphEdge> edges, int[] edgeSource, int[] edgeTarget, double[] edgeWeight,
                         int[][] incoming, int[][] outgoing, long referenceTime) {
        this.nodeIds = nodeIds;
        this.indexById = indexById;
        this.attributes = attributes;
        this.edges = edges;
        this.edgeSource = edgeSource;
        this.edgeTarget = edgeTarget;
        this.edgeWeight = edgeWeight;
        this.incoming = incoming;
        this.outgoing = outgoing;
        this.referenceTime = referenceTime;
    }

    /**
     * Builds the indexed view. The snapshot must already have passed {@link GraphValidator}.
     */
    public static IndexedGraph build(GraphSnapshot snapshot, ScoringConfig config) {
        List<GraphNode> nodes = snapshot.nodesOrEmpty();
        List<GraphEdge> edges = snapshot.edgesOrEmpty();
        int n = nodes.size();
        int m = edges.size();

        List<String> ids = new ArrayList<>(n);
        Map<String, Integer> index = new HashMap<>(n * 2);
        NodeAttributes[] attrs = new NodeAttributes[n];
        for (int i = 0; i < n; i++) {
            GraphNode node = nodes.get(i);
            ids.add(node.getId());
            index.put(node.getId(), i);
            attrs[i] = node.attributesOrEmpty();
        }

        long reference = 0L;
        for (GraphEdge edge : edges) {
            reference = Math.max(reference, edge.getTimestamp());
        }

        EdgeWeighting weighting = new EdgeWeighting(config);
        int[] src = new int[m];
        int[] dst = new int[m];
        double[] weight = new double[m];
        int[] inCount = new int[n];
        int[] outCount = new int[n];
        for (int e = 0; e < m; e++) {
            GraphEdge edge = edges.get(e);
            src[e] = index.get(edge.getSource());
            dst[e] = index.get(edge.getTarget());
            weight[e] = weighting.effectiveWeight(edge, reference);
            outCount[src[e]]++;
            inCount[dst[e]]++;
        }

        int[][] in = new int[n][];
        int[][] out = new int[n][];
        for (int i = 0; i < n; i++) {
            in[i] = new int[inCount[i]];
            out[i] = new int[outCount[i]];
        }
        int[] inFill = new int[n];
        int[] outFill = new int[n];
        for (int e = 0; e < m; e++) {
            out[src[e]][outFill[src[e]]++] = e;
            in[dst[e]][inFill[dst[e]]++] = e;
        }

        return new IndexedGraph(Collections.unmodifiableList(ids), index, attrs, edges,
                src, dst, weight, in, out, reference);
    }

    public int nodeCount() {
        return nodeIds.size();
    }

    public int edgeCount() {
        return edgeSource.length;
    }

    public String nodeId(int index) {
        return nodeIds.get(index);
    }

    public List<String> nodeIds() {
        return nodeIds;
    }

    public Integer indexOf(String nodeId) {
        return indexById.get(nodeId);
    }

    public NodeAttributes attributes(int index) {
        return attributes[index];
    }

    public GraphEdge edge(int edgeIndex) {
        return edges.get(edgeIndex);
    }

    public int source(int edgeIndex) {
        return edgeSource[edgeIndex];
    }

    public int target(int edgeIndex) {
        return edgeTarget[edgeIndex];
    }

    public double weight(int edgeIndex) {
        return edgeWeight[edgeIndex];
    }

    /** Incoming edge indices of a node, ascending. */
    public int[] incoming(int node) {
        return incoming[node];
    }

    /** Outgoing edge indices of a node, ascending. */
    public int[] outgoing(int node) {
        return outgoing[node];
    }

    /** Newest edge timestamp; decay ages are measured from here. */
    public long referenceTime() {
        return referenceTime;
    }
}

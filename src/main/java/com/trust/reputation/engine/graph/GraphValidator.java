package com.trust.reputation.engine.graph;

import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.model.GraphEdge;
import com.trust.reputation.model.GraphNode;
import com.trust.reputation.model.GraphSnapshot;
import com.trust.reputation.model.NodeAttributes;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects snapshots and configurations that cannot be scored. The first violation wins.
 */
public final class GraphValidator {

    private GraphValidator() {}

    public static void validateConfig(ScoringConfig config) {
        if (config == null) {
            throw new InputValidationException("scoring config is required", "config", "scoring");
        }
        double d = config.getDampingFactor();
        if (!(d > 0 && d < 1)) {
            throw new InputValidationException("dampingFactor must be in (0, 1), was " + d, "config", "dampingFactor");
        }
        if (config.getMaxIterations() <= 0) {
            throw new InputValidationException("maxIterations must be > 0", "config", "maxIterations");
        }
        requireNonNegative(config.getTolerance(), "config", "tolerance");
        requireNonNegative(config.getTemporalDecay(), "config", "temporalDecay");
        if (!(config.getRecencyWeight() >= 0 && config.getRecencyWeight() <= 1)) {
            throw new InputValidationException("recencyWeight must be in [0, 1]", "config", "recencyWeight");
        }
        if (config.getDecayTimeUnitMs() <= 0) {
            throw new InputValidationException("decayTimeUnitMs must be > 0", "config", "decayTimeUnitMs");
        }
        requireNonNegative(config.getStakeEdgeBoost(), "config", "stakeEdgeBoost");
        requireNonNegative(config.getPaymentEdgeBoost(), "config", "paymentEdgeBoost");
        requireNonNegative(config.getVerifiedEdgeBoost(), "config", "verifiedEdgeBoost");
        requireNonNegative(config.getGraphScoreScale(), "config", "graphScoreScale");
        requireNonNegative(config.getSubscoreCap(), "config", "subscoreCap");
        requireNonNegative(config.getTeleportEconomicBias(), "config", "teleportEconomicBias");
        requireNonNegative(config.getFairnessAdjustmentStrength(), "config", "fairnessAdjustmentStrength");
        if (!(config.getVerifiedEndorsementShare() >= 0 && config.getVerifiedEndorsementShare() <= 1)) {
            throw new InputValidationException("verifiedEndorsementShare must be in [0, 1]",
                    "config", "verifiedEndorsementShare");
        }
        if (config.isEnableHybridScoring()) {
            ScoringConfig.HybridWeights w = config.getHybridWeights();
            if (w == null) {
                throw new InputValidationException("hybridWeights are required when hybrid scoring is enabled",
                        "config", "hybridWeights");
            }
            requireNonNegative(w.getGraph(), "config", "hybridWeights.graph");
            requireNonNegative(w.getQuality(), "config", "hybridWeights.quality");
            requireNonNegative(w.getStake(), "config", "hybridWeights.stake");
            requireNonNegative(w.getPayment(), "config", "hybridWeights.payment");
            if (w.sum() <= 0) {
                throw new InputValidationException("hybrid weights sum to zero", "config", "hybridWeights");
            }
        }
        if (config.isEnableSybilDetection()) {
            ScoringConfig.SybilWeights s = config.getSybilWeights();
            if (s == null) {
                throw new InputValidationException("sybilWeights are required when sybil detection is enabled",
                        "config", "sybilWeights");
            }
            requireNonNegative(s.getClusteringCoefficient(), "config", "sybilWeights.clusteringCoefficient");
            requireNonNegative(s.getRecentBurst(), "config", "sybilWeights.recentBurst");
            requireNonNegative(s.getEconomicMismatch(), "config", "sybilWeights.economicMismatch");
            requireNonNegative(s.getFanOutSpam(), "config", "sybilWeights.fanOutSpam");
        }
        if (config.getAuditTopK() <= 0) {
            throw new InputValidationException("auditTopK must be > 0", "config", "auditTopK");
        }
        if (config.getMaxAuditedNodes() < 0) {
            throw new InputValidationException("maxAuditedNodes must be >= 0", "config", "maxAuditedNodes");
        }
    }

    public static void validateSnapshot(GraphSnapshot snapshot, ScoringConfig config) {
        if (snapshot == null) {
            throw new InputValidationException("graph snapshot is required", "snapshot", "snapshot");
        }
        Set<String> ids = new HashSet<>();
        List<GraphNode> nodes = snapshot.nodesOrEmpty();
        for (int i = 0; i < nodes.size(); i++) {
            GraphNode node = nodes.get(i);
            if (node == null || node.getId() == null) {
                throw new InputValidationException("node at index " + i + " has no id", "node#" + i, "id");
            }
            if (!ids.add(node.getId())) {
                throw new InputValidationException("duplicate node id " + node.getId(), node.getId(), "id");
            }
            validateAttributes(node.getId(), node.attributesOrEmpty());
        }

        List<GraphEdge> edges = snapshot.edgesOrEmpty();
        for (int i = 0; i < edges.size(); i++) {
            GraphEdge edge = edges.get(i);
            if (edge == null) {
                throw new InputValidationException("edge " + i + " is null", "edge#" + i, "edge");
            }
            String ref = edgeRef(i, edge);
            if (!ids.contains(edge.getSource())) {
                throw new InputValidationException(ref + " references unknown source node", ref, "source");
            }
            if (!ids.contains(edge.getTarget())) {
                throw new InputValidationException(ref + " references unknown target node", ref, "target");
            }
            if (!config.isAllowSelfLoops() && edge.getSource().equals(edge.getTarget())) {
                throw new InputValidationException(ref + " is a self-loop", ref, "target");
            }
            if (!Double.isFinite(edge.getWeight()) || edge.getWeight() < 0) {
                throw new InputValidationException(ref + " has invalid weight " + edge.getWeight(), ref, "weight");
            }
            if (edge.getTimestamp() < 0) {
                throw new InputValidationException(ref + " has a negative timestamp", ref, "timestamp");
            }
            Double amount = edge.attributesOrEmpty().getPaymentAmount();
            if (amount != null && (!Double.isFinite(amount) || amount < 0)) {
                throw new InputValidationException(ref + " has invalid paymentAmount", ref, "paymentAmount");
            }
        }
    }

    public static void validateAuditRequest(Collection<String> auditNodeIds, Set<String> knownIds, int maxAuditedNodes) {
        if (auditNodeIds == null) {
            return;
        }
        if (auditNodeIds.size() > maxAuditedNodes) {
            throw new InputValidationException("audit request for " + auditNodeIds.size()
                    + " nodes exceeds maxAuditedNodes=" + maxAuditedNodes, "audit", "auditNodeIds");
        }
        for (String id : auditNodeIds) {
            if (id == null || !knownIds.contains(id)) {
                throw new InputValidationException("audit requested for unknown node " + id, String.valueOf(id),
                        "auditNodeIds");
            }
        }
    }

    public static String edgeRef(int index, GraphEdge edge) {
        return "edge#" + index + " (" + edge.getSource() + "->" + edge.getTarget() + ")";
    }

    private static void validateAttributes(String nodeId, NodeAttributes attrs) {
        requireFiniteNonNegative(attrs.getStake(), nodeId, "stake");
        requireFiniteNonNegative(attrs.getPaymentHistory(), nodeId, "paymentHistory");
        requireFiniteNonNegative(attrs.getContentQuality(), nodeId, "contentQuality");
        if (attrs.getVerifiedEndorsements() != null && attrs.getVerifiedEndorsements() < 0) {
            throw new InputValidationException("verifiedEndorsements must be >= 0", nodeId, "verifiedEndorsements");
        }
    }

    private static void requireFiniteNonNegative(Double value, String subject, String field) {
        if (value != null && (!Double.isFinite(value) || value < 0)) {
            throw new InputValidationException(field + " must be a finite non-negative number, was " + value,
                    subject, field);
        }
    }

    private static void requireNonNegative(double value, String subject, String field) {
        if (!Double.isFinite(value) || value < 0) {
            throw new InputValidationException(field + " must be a finite non-negative number, was " + value,
                    subject, field);
        }
    }
}

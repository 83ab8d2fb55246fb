package com.trust.reputation.config;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunables of one reputation scoring run. None of these values is an invariant;
 * operators adjust them per deployment.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Reputation scoring configuration")
public class ScoringConfig {

    // PageRank
    private double dampingFactor = 0.85;
    private int maxIterations = 100;
    private double tolerance = 1e-6;

    // Temporal decay: weight * (recencyWeight + (1 - recencyWeight) * exp(-temporalDecay * age / decayTimeUnitMs))
    private double temporalDecay = 0.1;
    private double recencyWeight = 0.3;
    private long decayTimeUnitMs = 365L * 24 * 60 * 60 * 1000;

    // Edge boosts
    private double stakeEdgeBoost = 0.2;
    private double paymentEdgeBoost = 0.15;
    private double verifiedEdgeBoost = 0.2;

    // Teleport bias toward economically committed nodes (0 = uniform)
    private double teleportEconomicBias = 1.0;

    // Sub-score scaling
    private double graphScoreScale = 100.0;
    private double subscoreCap = 1000.0;
    private double verifiedEndorsementShare = 0.2;

    private boolean allowSelfLoops = false;

    // Hybrid scoring
    private boolean enableHybridScoring = true;
    private HybridWeights hybridWeights = new HybridWeights();

    // Fairness
    private boolean enableFairnessConstraints = true;
    private boolean applyFairnessAdjustments = true;
    private double fairnessAdjustmentStrength = 0.2;

    // Sybil estimation
    private boolean enableSybilDetection = true;
    private SybilWeights sybilWeights = new SybilWeights();
    private long recentWindowMs = 30L * 24 * 60 * 60 * 1000;
    private double sybilReportThreshold = 0.5;

    // Sensitivity audit
    private boolean enableSensitivityAudit = false;
    private boolean auditOutgoingEdges = false;
    private int auditTopN = 10;
    private int auditTopK = 10;
    private int maxAuditedNodes = 50;

    private boolean detectDeceptiveEdges = false;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HybridWeights {
        private double graph = 0.5;
        private double quality = 0.25;
        private double stake = 0.15;
        private double payment = 0.1;

        public double sum() {
            return graph + quality + stake + payment;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SybilWeights {
        private double clusteringCoefficient = 0.35;
        private double recentBurst = 0.25;
        private double economicMismatch = 0.3;
        private double fanOutSpam = 0.1;
    }
}

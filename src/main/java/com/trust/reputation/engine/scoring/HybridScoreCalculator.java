package com.trust.reputation.engine.scoring;

import com.trust.reputation.config.ScoringConfig;

/**
 * finalScore = sum(w_k * s_k) / sum(w_k). Weights are validated non-negative with a
 * positive sum before a run starts.
 */
public class HybridScoreCalculator {

    private final boolean enabled;
    private final ScoringConfig.HybridWeights weights;

    public HybridScoreCalculator(ScoringConfig config) {
        this.enabled = config.isEnableHybridScoring();
        this.weights = config.getHybridWeights();
    }

    public double finalScore(double graph, double quality, double stake, double payment) {
        if (!enabled) {
            return graph;
        }
        double weighted = weights.getGraph() * graph
                + weights.getQuality() * quality
                + weights.getStake() * stake
                + weights.getPayment() * payment;
        return weighted / weights.sum();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public ScoringConfig.HybridWeights getWeights() {
        return weights;
    }
}

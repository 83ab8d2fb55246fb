package com.trust.reputation.engine.graph;

import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.model.EdgeAttributes;
import com.trust.reputation.model.EdgeType;
import com.trust.reputation.model.GraphEdge;

/**
 * Effective edge weight: declared weight, economic boosts and temporal decay.
 * Age is measured from a reference time, normally the newest edge of the snapshot,
 * so the result never depends on the wall clock.
 */
public final class EdgeWeighting {

    private static final double PAYMENT_SCALE = 1000.0;
    private static final double PAYMENT_LOG_SATURATION = 10.0;

    private final ScoringConfig config;

    public EdgeWeighting(ScoringConfig config) {
        this.config = config;
    }

    public double effectiveWeight(GraphEdge edge, long referenceTime) {
        return edge.getWeight() * boost(edge) * temporalFactor(edge.getTimestamp(), referenceTime);
    }

    double boost(GraphEdge edge) {
        EdgeAttributes attrs = edge.attributesOrEmpty();
        double boost = 1.0;
        if (attrs.isStakeBacked()) {
            boost *= 1.0 + config.getStakeEdgeBoost();
        }
        if (edge.getEdgeType() == EdgeType.PAYMENT && attrs.getPaymentAmount() != null) {
            double paymentFactor = Math.min(1.0,
                    Math.log1p(attrs.getPaymentAmount() / PAYMENT_SCALE) / PAYMENT_LOG_SATURATION);
            boost *= 1.0 + config.getPaymentEdgeBoost() * paymentFactor;
        }
        if (attrs.isVerified()) {
            boost *= 1.0 + config.getVerifiedEdgeBoost();
        }
        return boost;
    }

    double temporalFactor(long timestamp, long referenceTime) {
        double age = Math.max(0L, referenceTime - timestamp) / (double) config.getDecayTimeUnitMs();
        double decay = Math.exp(-config.getTemporalDecay() * age);
        return config.getRecencyWeight() + (1.0 - config.getRecencyWeight()) * decay;
    }
}

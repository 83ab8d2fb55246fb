package com.trust.reputation.engine.scoring;

import com.trust.reputation.config.ScoringConfig;
import com.trust.reputation.model.NodeAttributes;

/**
 * Logarithmic economic and content sub-scores, each in [0, subscoreCap].
 */
public class SubScoreCalculator {

    private static final double LOG_SCALE = 200.0;
    private static final double STAKE_UNIT = 100.0;
    private static final double PAYMENT_UNIT = 1000.0;
    private static final double QUALITY_SCALE = 10.0;

    private final ScoringConfig config;

    public SubScoreCalculator(ScoringConfig config) {
        this.config = config;
    }

    /** A uniform rank (1/N) maps to graphScoreScale. */
    public double graphScore(double rank, int nodeCount) {
        return rank * nodeCount * config.getGraphScoreScale();
    }

    public double qualityScore(NodeAttributes attrs) {
        double share = config.getVerifiedEndorsementShare();
        double content = Math.min(config.getSubscoreCap(), attrs.contentQualityOrZero() * QUALITY_SCALE);
        double endorsements = capped(LOG_SCALE * Math.log1p(attrs.verifiedEndorsementsOrZero()));
        return (1.0 - share) * content + share * endorsements;
    }

    public double stakeScore(NodeAttributes attrs) {
        return capped(LOG_SCALE * Math.log1p(attrs.stakeOrZero() / STAKE_UNIT));
    }

    public double paymentScore(NodeAttributes attrs) {
        return capped(LOG_SCALE * Math.log1p(attrs.paymentHistoryOrZero() / PAYMENT_UNIT));
    }

    /** Mean of the normalized stake and payment scores, in [0, 1]. */
    public double economicSignal(double stakeScore, double paymentScore) {
        double cap = config.getSubscoreCap();
        if (cap <= 0) {
            return 0.0;
        }
        return (stakeScore / cap + paymentScore / cap) / 2.0;
    }

    private double capped(double value) {
        return Math.min(config.getSubscoreCap(), value);
    }
}

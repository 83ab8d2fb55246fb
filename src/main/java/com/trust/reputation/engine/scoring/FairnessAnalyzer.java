package com.trust.reputation.engine.scoring;

import com.trust.reputation.model.FairnessMetrics;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Heuristic bias diagnostics and an optional rank adjustment for the minority group.
 * Neither is a correctness guarantee.
 */
public class FairnessAnalyzer {

    private final double adjustmentStrength;

    public FairnessAnalyzer(double adjustmentStrength) {
        this.adjustmentStrength = adjustmentStrength;
    }

    /**
     * Lifts minority ranks by 1 + strength * (mean / minorityMean - 1) when the minority
     * mean is lower, then rescales every rank so the total mass is unchanged.
     *
     * @return adjusted copy, or the input itself when no adjustment applies
     */
    public double[] adjustRanks(double[] ranks, boolean[] minority) {
        int n = ranks.length;
        int minorityCount = 0;
        double total = 0.0;
        double minorityTotal = 0.0;
        for (int i = 0; i < n; i++) {
            total += ranks[i];
            if (minority[i]) {
                minorityCount++;
                minorityTotal += ranks[i];
            }
        }
        if (minorityCount == 0 || minorityCount == n || minorityTotal <= 0.0 || adjustmentStrength <= 0.0) {
            return ranks;
        }
        double mean = total / n;
        double minorityMean = minorityTotal / minorityCount;
        if (minorityMean >= mean) {
            return ranks;
        }

        double factor = 1.0 + adjustmentStrength * (mean / minorityMean - 1.0);
        double[] adjusted = new double[n];
        double adjustedTotal = 0.0;
        for (int i = 0; i < n; i++) {
            adjusted[i] = minority[i] ? ranks[i] * factor : ranks[i];
            adjustedTotal += adjusted[i];
        }
        double rescale = total / adjustedTotal;
        for (int i = 0; i < n; i++) {
            adjusted[i] *= rescale;
        }
        return adjusted;
    }

    public FairnessMetrics analyze(List<String> nodeIds, double[] finalScores, boolean[] minority) {
        int n = finalScores.length;
        if (n == 0) {
            return FairnessMetrics.empty();
        }

        double gini = gini(finalScores);

        // Top decile by score desc, ties by node id
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> -finalScores[i])
                .thenComparing(nodeIds::get));
        int topCount = Math.max(1, (int) Math.ceil(n / 10.0));

        int minorityTotal = 0;
        for (boolean m : minority) {
            if (m) minorityTotal++;
        }
        int minorityTop = 0;
        for (int k = 0; k < topCount; k++) {
            if (minority[order[k]]) minorityTop++;
        }

        double representation;
        if (minorityTotal == 0) {
            representation = 1.0;
        } else {
            double populationShare = (double) minorityTotal / n;
            double topShare = (double) minorityTop / topCount;
            representation = topShare / populationShare;
        }

        double diversity = topDecileDiversity(minorityTop, topCount, minorityTotal, n);
        double bias = 0.5 * Math.max(0.0, 1.0 - representation) + 0.5 * (1.0 - diversity);

        return FairnessMetrics.builder()
                .giniCoefficient(gini)
                .minorityRepresentation(representation)
                .topDecileDiversity(diversity)
                .biasScore(bias)
                .build();
    }

    static double gini(double[] values) {
        int n = values.length;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double sum = 0.0;
        double weighted = 0.0;
        for (int i = 0; i < n; i++) {
            sum += sorted[i];
            weighted += (2.0 * (i + 1) - n - 1) * sorted[i];
        }
        if (sum <= 0.0) {
            return 0.0;
        }
        return weighted / (n * sum);
    }

    // Shannon entropy of the group mix, normalized by the entropy the population allows
    private static double topDecileDiversity(int minorityTop, int topCount, int minorityTotal, int n) {
        boolean populationMixed = minorityTotal > 0 && minorityTotal < n;
        if (!populationMixed) {
            return 1.0;
        }
        double entropy = 0.0;
        double pMinority = (double) minorityTop / topCount;
        double pMajority = 1.0 - pMinority;
        if (pMinority > 0) entropy -= pMinority * Math.log(pMinority);
        if (pMajority > 0) entropy -= pMajority * Math.log(pMajority);
        return entropy / Math.log(2.0);
    }
}

package com.trust.reputation.engine.scoring;

import java.util.List;

/**
 * Exponentially decayed rolling average that damps score volatility between runs.
 */
public final class ScoreSmoother {

    private ScoreSmoother() {}

    /**
     * @param current latest score, weight 1
     * @param history earlier scores, oldest first; only the newest {@code window - 1} are used
     * @param window  number of scores averaged, including the current one
     * @param decay   weight multiplier per step back in time, in (0, 1]
     */
    public static double rollingAverage(double current, List<Double> history, int window, double decay) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1");
        }
        if (!(decay > 0 && decay <= 1)) {
            throw new IllegalArgumentException("decay must be in (0, 1]");
        }
        if (history == null || history.isEmpty() || window == 1) {
            return current;
        }
        double weighted = current;
        double totalWeight = 1.0;
        double weight = 1.0;
        int used = Math.min(window - 1, history.size());
        for (int k = 0; k < used; k++) {
            Double value = history.get(history.size() - 1 - k);
            weight *= decay;
            if (value == null) {
                continue;
            }
            weighted += weight * value;
            totalWeight += weight;
        }
        return weighted / totalWeight;
    }
}

package com.trust.reputation.engine.scoring;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Ascending rank percentiles. Position k (1-based) maps to 100k/N and exactly equal
 * scores share the mean of their positions, so the percentiles always sum to 50(N+1).
 */
public final class PercentileRanker {

    private PercentileRanker() {}

    public static double[] percentiles(double[] scores) {
        int n = scores.length;
        double[] result = new double[n];
        if (n == 0) {
            return result;
        }
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> scores[i]).thenComparingInt(i -> i));

        int start = 0;
        while (start < n) {
            int end = start;
            while (end + 1 < n && Double.compare(scores[order[end + 1]], scores[order[start]]) == 0) {
                end++;
            }
            // positions start+1 .. end+1 share their mean
            double meanPosition = (start + 1 + end + 1) / 2.0;
            double percentile = 100.0 * meanPosition / n;
            for (int k = start; k <= end; k++) {
                result[order[k]] = percentile;
            }
            start = end + 1;
        }
        return result;
    }
}

package com.trust.reputation.engine.clustering;

import java.util.List;

/**
 * Mean silhouette (b - a) / max(a, b) over clustered accounts with distance
 * 1 - similarity. With a single cluster, b is taken as 1. Singletons score 0 and
 * unclustered accounts are ignored.
 */
public final class SilhouetteScorer {

    private SilhouetteScorer() {}

    public static double score(ClusteringContext context, List<int[]> clusters) {
        int points = 0;
        double total = 0.0;
        for (int c = 0; c < clusters.size(); c++) {
            int[] own = clusters.get(c);
            for (int i : own) {
                points++;
                if (own.length < 2) {
                    continue;
                }
                double a = meanDistance(context, i, own);
                double b = clusters.size() == 1 ? 1.0 : Double.MAX_VALUE;
                for (int other = 0; other < clusters.size(); other++) {
                    if (other != c) {
                        b = Math.min(b, meanDistance(context, i, clusters.get(other)));
                    }
                }
                double scale = Math.max(a, b);
                total += scale > 0 ? (b - a) / scale : 0.0;
            }
        }
        return points == 0 ? 0.0 : total / points;
    }

    private static double meanDistance(ClusteringContext context, int i, int[] members) {
        double sum = 0.0;
        int count = 0;
        for (int j : members) {
            if (j != i) {
                sum += 1.0 - context.similarity(i, j);
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }
}

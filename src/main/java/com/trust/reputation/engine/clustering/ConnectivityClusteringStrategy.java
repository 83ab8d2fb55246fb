package com.trust.reputation.engine.clustering;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.model.ClusteringMethod;

import java.util.List;

/**
 * Union-find over every pair at or above minSimilarity; clusters are the components.
 */
public class ConnectivityClusteringStrategy implements ClusteringStrategy {

    @Override
    public ClusteringMethod getSupportedMethod() {
        return ClusteringMethod.CONNECTIVITY;
    }

    @Override
    public List<int[]> cluster(ClusteringContext context, ClusteringConfig config) {
        return components(context, config.getMinSimilarity(), null);
    }

    /**
     * Components of the threshold graph, optionally restricted to a subset of accounts.
     *
     * @param members ascending account indices to consider, or null for all
     */
    static List<int[]> components(ClusteringContext context, double threshold, int[] members) {
        int n = members != null ? members.length : context.size();
        UnionFind unionFind = new UnionFind(n);
        for (int a = 0; a < n; a++) {
            int i = members != null ? members[a] : a;
            for (int b = a + 1; b < n; b++) {
                int j = members != null ? members[b] : b;
                if (context.similarity(i, j) >= threshold) {
                    unionFind.union(a, b);
                }
            }
        }
        List<int[]> local = unionFind.components(2);
        if (members != null) {
            for (int[] group : local) {
                for (int k = 0; k < group.length; k++) {
                    group[k] = members[group[k]];
                }
            }
        }
        return local;
    }
}

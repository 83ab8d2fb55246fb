package com.trust.reputation.engine.clustering;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.model.ClusteringMethod;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Agglomerative average-linkage clustering. Cluster similarities are updated with the
 * Lance-Williams formula; merging stops when no pair reaches minSimilarity. Merges
 * that would exceed maxClusterSize are skipped and ties go to the lowest index pair.
 */
public class HierarchicalClusteringStrategy implements ClusteringStrategy {

    @Override
    public ClusteringMethod getSupportedMethod() {
        return ClusteringMethod.HIERARCHICAL;
    }

    @Override
    public List<int[]> cluster(ClusteringContext context, ClusteringConfig config) {
        SimilarityMatrix matrix = context.matrix();
        int n = matrix.size();
        double threshold = config.getMinSimilarity();
        int maxSize = config.getMaxClusterSize();

        double[] linkage = matrix.copyCells();
        boolean[] active = new boolean[n];
        int[] size = new int[n];
        List<List<Integer>> members = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            active[i] = true;
            size[i] = 1;
            List<Integer> single = new ArrayList<>();
            single.add(i);
            members.add(single);
        }

        while (true) {
            int bestI = -1;
            int bestJ = -1;
            double best = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < n; i++) {
                if (!active[i]) continue;
                for (int j = i + 1; j < n; j++) {
                    if (!active[j] || size[i] + size[j] > maxSize) continue;
                    double s = linkage[matrix.offset(i, j)];
                    if (s >= threshold && s > best) {
                        best = s;
                        bestI = i;
                        bestJ = j;
                    }
                }
            }
            if (bestI < 0) {
                break;
            }
            merge(matrix, linkage, active, size, bestI, bestJ);
            members.get(bestI).addAll(members.get(bestJ));
            members.get(bestJ).clear();
        }

        List<int[]> groups = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (active[i] && size[i] >= 2) {
                int[] group = members.get(i).stream().mapToInt(Integer::intValue).toArray();
                Arrays.sort(group);
                groups.add(group);
            }
        }
        return groups;
    }

    // Folds cluster b into a: s(a+b, k) = (|a| s(a, k) + |b| s(b, k)) / (|a| + |b|)
    private static void merge(SimilarityMatrix matrix, double[] linkage, boolean[] active, int[] size, int a, int b) {
        int n = matrix.size();
        double total = size[a] + size[b];
        for (int k = 0; k < n; k++) {
            if (!active[k] || k == a || k == b) continue;
            int ak = k < a ? matrix.offset(k, a) : matrix.offset(a, k);
            int bk = k < b ? matrix.offset(k, b) : matrix.offset(b, k);
            linkage[ak] = (size[a] * linkage[ak] + size[b] * linkage[bk]) / total;
        }
        active[b] = false;
        size[a] += size[b];
        size[b] = 0;
    }
}

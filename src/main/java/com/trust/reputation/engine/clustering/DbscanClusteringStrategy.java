package com.trust.reputation.engine.clustering;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.model.ClusteringMethod;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * DBSCAN with similarity as the neighborhood test: j is a neighbor of i when
 * similarity(i, j) >= dbscanEps. A core point has at least dbscanMinPts neighbors.
 * Points are visited in index order, so border points join the first cluster that
 * reaches them. Noise points are left out.
 */
public class DbscanClusteringStrategy implements ClusteringStrategy {

    private static final int UNVISITED = -2;
    private static final int NOISE = -1;

    @Override
    public ClusteringMethod getSupportedMethod() {
        return ClusteringMethod.DBSCAN;
    }

    @Override
    public List<int[]> cluster(ClusteringContext context, ClusteringConfig config) {
        int n = context.size();
        double eps = config.getDbscanEps();
        int minPts = config.getDbscanMinPts();

        int[] label = new int[n];
        Arrays.fill(label, UNVISITED);
        List<List<Integer>> clusters = new ArrayList<>();

        for (int p = 0; p < n; p++) {
            if (label[p] != UNVISITED) {
                continue;
            }
            List<Integer> neighbors = regionQuery(context, p, eps);
            if (neighbors.size() < minPts) {
                label[p] = NOISE;
                continue;
            }

            int clusterId = clusters.size();
            List<Integer> members = new ArrayList<>();
            clusters.add(members);
            label[p] = clusterId;
            members.add(p);

            Deque<Integer> seeds = new ArrayDeque<>(neighbors);
            while (!seeds.isEmpty()) {
                int q = seeds.poll();
                if (label[q] == NOISE) {
                    label[q] = clusterId;
                    members.add(q);
                }
                if (label[q] != UNVISITED) {
                    continue;
                }
                label[q] = clusterId;
                members.add(q);
                List<Integer> qNeighbors = regionQuery(context, q, eps);
                if (qNeighbors.size() >= minPts) {
                    seeds.addAll(qNeighbors);
                }
            }
        }

        List<int[]> groups = new ArrayList<>(clusters.size());
        for (List<Integer> members : clusters) {
            int[] sorted = members.stream().mapToInt(Integer::intValue).toArray();
            Arrays.sort(sorted);
            groups.add(sorted);
        }
        return groups;
    }

    private static List<Integer> regionQuery(ClusteringContext context, int p, double eps) {
        List<Integer> neighbors = new ArrayList<>();
        for (int q = 0; q < context.size(); q++) {
            if (q != p && context.similarity(p, q) >= eps) {
                neighbors.add(q);
            }
        }
        return neighbors;
    }
}

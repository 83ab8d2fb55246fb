package com.trust.reputation.engine.clustering;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.model.ClusteringMethod;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Breadth-first connected components of the graph whose edges are the pairs at or
 * above minSimilarity.
 */
public class SimilarityGraphClusteringStrategy implements ClusteringStrategy {

    @Override
    public ClusteringMethod getSupportedMethod() {
        return ClusteringMethod.SIMILARITY;
    }

    @Override
    public List<int[]> cluster(ClusteringContext context, ClusteringConfig config) {
        int n = context.size();
        double threshold = config.getMinSimilarity();

        List<List<Integer>> adjacency = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adjacency.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (context.similarity(i, j) >= threshold) {
                    adjacency.get(i).add(j);
                    adjacency.get(j).add(i);
                }
            }
        }

        boolean[] visited = new boolean[n];
        List<int[]> groups = new ArrayList<>();
        for (int start = 0; start < n; start++) {
            if (visited[start] || adjacency.get(start).isEmpty()) {
                continue;
            }
            List<Integer> component = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            visited[start] = true;
            while (!queue.isEmpty()) {
                int current = queue.poll();
                component.add(current);
                for (int neighbor : adjacency.get(current)) {
                    if (!visited[neighbor]) {
                        visited[neighbor] = true;
                        queue.add(neighbor);
                    }
                }
            }
            int[] members = component.stream().mapToInt(Integer::intValue).toArray();
            Arrays.sort(members);
            groups.add(members);
        }
        return groups;
    }
}

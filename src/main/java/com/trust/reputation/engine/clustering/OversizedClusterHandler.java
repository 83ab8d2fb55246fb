package com.trust.reputation.engine.clustering;

import com.trust.reputation.config.ClusteringConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Brings candidate groups within maxClusterSize according to the configured
 * {@link com.trust.reputation.model.OversizePolicy}.
 */
public class OversizedClusterHandler {

    private static final Logger log = LoggerFactory.getLogger(OversizedClusterHandler.class);

    private final ClusteringConfig config;

    public OversizedClusterHandler(ClusteringConfig config) {
        this.config = config;
    }

    public List<int[]> enforce(ClusteringContext context, List<int[]> groups, double threshold) {
        int maxSize = config.getMaxClusterSize();
        List<int[]> result = new ArrayList<>(groups.size());
        for (int[] group : groups) {
            if (group.length <= maxSize) {
                result.add(group);
                continue;
            }
            switch (config.getOversizePolicy()) {
                case SPLIT -> result.addAll(split(context, group, threshold, 1));
                case TRUNCATE -> {
                    log.warn("Truncating component of {} accounts to maxClusterSize={}", group.length, maxSize);
                    result.add(truncate(context, group, maxSize));
                }
                case REJECT -> log.warn("Rejecting component of {} accounts above maxClusterSize={}",
                        group.length, maxSize);
            }
        }
        return result;
    }

    private List<int[]> split(ClusteringContext context, int[] group, double baseThreshold, int depth) {
        int maxSize = config.getMaxClusterSize();
        double raised = baseThreshold + depth * config.getSplitThresholdStep();
        if (raised > 1.0) {
            log.warn("Component of {} accounts still above maxClusterSize={} at threshold 1.0, truncating",
                    group.length, maxSize);
            return List.of(truncate(context, group, maxSize));
        }
        log.warn("Splitting component of {} accounts above maxClusterSize={} at threshold {}",
                group.length, maxSize, raised);

        List<int[]> result = new ArrayList<>();
        for (int[] part : ConnectivityClusteringStrategy.components(context, raised, group)) {
            if (part.length > maxSize) {
                result.addAll(split(context, part, baseThreshold, depth + 1));
            } else {
                result.add(part);
            }
        }
        return result;
    }

    /**
     * Keeps the members with the highest mean similarity to the rest of the group,
     * ties by index.
     */
    static int[] truncate(ClusteringContext context, int[] group, int keep) {
        double[] meanSimilarity = new double[group.length];
        for (int a = 0; a < group.length; a++) {
            double total = 0.0;
            for (int b = 0; b < group.length; b++) {
                if (a != b) {
                    total += context.similarity(group[a], group[b]);
                }
            }
            meanSimilarity[a] = group.length > 1 ? total / (group.length - 1) : 0.0;
        }
        Integer[] order = new Integer[group.length];
        for (int a = 0; a < group.length; a++) {
            order[a] = a;
        }
        Arrays.sort(order, Comparator.<Integer>comparingDouble(a -> -meanSimilarity[a])
                .thenComparingInt(a -> group[a]));
        int[] kept = new int[Math.min(keep, group.length)];
        for (int k = 0; k < kept.length; k++) {
            kept[k] = group[order[k]];
        }
        Arrays.sort(kept);
        return kept;
    }
}

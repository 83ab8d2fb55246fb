package com.trust.reputation.engine.clustering;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.model.ClusteringMethod;

import java.util.List;

/**
 * One clustering algorithm over a shared similarity matrix.
 * Each implementation handles a specific ClusteringMethod.
 */
public interface ClusteringStrategy {

    /**
     * The method this strategy handles.
     */
    ClusteringMethod getSupportedMethod();

    /**
     * Candidate groups before size filtering and assembly.
     *
     * @param context run state with the similarity matrix
     * @param config  thresholds and method parameters for this run
     * @return groups of account indices, each ascending; groups may exceed maxClusterSize
     */
    List<int[]> cluster(ClusteringContext context, ClusteringConfig config);
}

package com.trust.reputation.config;

import com.trust.reputation.model.ClusteringMethod;
import com.trust.reputation.model.OversizePolicy;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Account clustering configuration")
public class ClusteringConfig {

    private ClusteringMethod method = ClusteringMethod.CONNECTIVITY;

    // Pairs at or above this similarity are linked
    @With
    private double minSimilarity = 0.3;

    private int minClusterSize = 2;
    private int maxClusterSize = 1000;

    // DBSCAN: eps is a similarity threshold, minPts counts neighbors excluding the point
    @With
    private double dbscanEps = 0.3;
    private int dbscanMinPts = 2;

    private FeatureWeights featureWeights = new FeatureWeights();

    // Feature normalization
    private int sharedConnectionsCap = 5;
    private long temporalWindowMs = 24L * 60 * 60 * 1000;
    private long registrationWindowMs = 30L * 24 * 60 * 60 * 1000;
    private int maxGraphDistance = 5;

    private OversizePolicy oversizePolicy = OversizePolicy.SPLIT;
    private double splitThresholdStep = 0.05;

    // Risk heuristics
    private int largeClusterSize = 10;
    private double lowReputationThreshold = 10.0;
    private int sharedEmailDomainMinAccounts = 4;
    private double highRiskThreshold = 0.7;

    // Fill the similarity matrix with a parallel stream over rows
    private boolean parallelSimilarity = false;
}

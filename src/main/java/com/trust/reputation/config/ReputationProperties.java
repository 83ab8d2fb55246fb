package com.trust.reputation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "reputation")
public class ReputationProperties {

    // Defaults for scoring runs; a request may carry its own ScoringConfig instead.
    private ScoringConfig scoring = new ScoringConfig();

    // Defaults for clustering runs and threshold sweeps.
    private ClusteringConfig clustering = new ClusteringConfig();

    // Default sweep range for /clusters/tune when the request omits it.
    private Tuning tuning = new Tuning();

    @Data
    public static class Tuning {
        private double minSimilarity = 0.1;
        private double maxSimilarity = 0.9;
        private double step = 0.1;
    }
}

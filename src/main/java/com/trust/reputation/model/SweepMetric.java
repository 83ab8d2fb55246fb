package com.trust.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Clustering quality at one similarity threshold")
public class SweepMetric {

    @Schema(example = "0.4")
    private double similarity;

    @Schema(example = "3")
    private int clusterCount;

    @Schema(example = "6.3")
    private double avgClusterSize;

    @Schema(example = "0.58")
    private double avgDensity;

    @Schema(example = "0.44")
    private double silhouetteScore;

    @Schema(description = "Silhouette penalized by cluster-count fragmentation", example = "0.40")
    private double penalizedScore;
}

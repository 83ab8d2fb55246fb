package com.trust.reputation.config;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Weights of the five pairwise similarity features. They need not sum to 1;
 * the similarity is normalized over the families that carry data.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Similarity feature weights")
public class FeatureWeights {

    @Schema(example = "0.30")
    private double sharedConnections = 0.30;

    @Schema(example = "0.25")
    private double connectionOverlap = 0.25;

    @Schema(example = "0.20")
    private double temporalSimilarity = 0.20;

    @Schema(example = "0.15")
    private double metadataSimilarity = 0.15;

    @Schema(example = "0.10")
    private double graphDistance = 0.10;

    public double sum() {
        return sharedConnections + connectionOverlap + temporalSimilarity + metadataSimilarity + graphDistance;
    }
}

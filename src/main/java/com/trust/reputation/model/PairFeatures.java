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
@Schema(description = "Raw similarity features of an account pair")
public class PairFeatures {

    public static final int UNKNOWN_DISTANCE = -1;

    @Schema(description = "Number of shared connection targets", example = "4")
    private int sharedConnections;

    @Schema(description = "Jaccard index of connection target sets", example = "0.5")
    private double connectionOverlap;

    @Schema(description = "Jaccard index of activity windows", example = "0.33")
    private double temporalSimilarity;

    @Schema(description = "Attribute agreement (0-1)", example = "0.75")
    private double metadataSimilarity;

    @Schema(description = "1 when directly connected, -1 when unknown or far", example = "1")
    private int graphDistance;
}

package com.trust.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Hybrid reputation score of a single node")
public class ReputationScore {

    @Schema(description = "Node identifier", example = "did:trust:alice")
    private String nodeId;

    @Schema(description = "PageRank component; 100 equals the uniform rank", example = "184.2")
    private double graphScore;

    @Schema(description = "Content quality component (0-1000)", example = "720.0")
    private double qualityScore;

    @Schema(description = "Logarithmic stake component (0-1000)", example = "786.0")
    private double stakeScore;

    @Schema(description = "Logarithmic payment component (0-1000)", example = "391.2")
    private double paymentScore;

    @Schema(description = "Weighted combination of the components", example = "412.7")
    private double finalScore;

    @Schema(description = "Rank within this run (0-100); ties share the mean of their positions", example = "87.5")
    private double percentile;

    @Schema(description = "Decayed rolling average with the caller's score history; null without history", example = "405.3")
    private Double smoothedScore;

    @Schema(description = "Ordered human-readable factors")
    private List<String> explanation;
}

package com.trust.reputation.model;

import com.trust.reputation.config.ScoringConfig;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scoring request for one graph snapshot")
public class ReputationRequest {

    @Schema(description = "Graph to score")
    private GraphSnapshot graph;

    @Schema(description = "Nodes to audit for edge sensitivity; omit to use the configured top-N")
    private List<String> auditNodeIds;

    @Schema(description = "Per-run configuration; omit to use the server defaults")
    private ScoringConfig config;

    @Schema(description = "Earlier finalScores per node, oldest first, used for smoothing")
    private Map<String, List<Double>> scoreHistory;

    @Schema(description = "Scores averaged by smoothing, including the current one", example = "5")
    private Integer smoothingWindow;

    @Schema(description = "Weight multiplier per step back in history (0-1]", example = "0.8")
    private Double smoothingDecay;
}

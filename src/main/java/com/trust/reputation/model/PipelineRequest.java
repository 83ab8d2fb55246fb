package com.trust.reputation.model;

import com.trust.reputation.config.ClusteringConfig;
import com.trust.reputation.config.ScoringConfig;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Score a graph, then cluster its nodes as accounts")
public class PipelineRequest {

    @Schema(description = "Graph to score")
    private GraphSnapshot graph;

    @Schema(description = "Raw profile attributes per node id (email domain, registration date, extensions)")
    private Map<String, AccountAttributes> accountAttributes;

    @Schema(description = "Scoring configuration; omit to use the server defaults")
    private ScoringConfig scoring;

    @Schema(description = "Clustering configuration; omit to use the server defaults")
    private ClusteringConfig clustering;
}

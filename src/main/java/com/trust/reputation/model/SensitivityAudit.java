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
@Schema(description = "Edge sensitivity audit for one node")
public class SensitivityAudit {

    @Schema(description = "Audited node", example = "did:trust:alice")
    private String nodeId;

    @Schema(description = "Graph score with every edge present", example = "184.2")
    private double baseScore;

    @Schema(description = "Impact of every audited edge, ordered by absolute impact")
    private List<EdgeImpact> edgeSensitivity;

    @Schema(description = "Top-K edges by absolute impact")
    private List<EdgeImpact> topInfluencingEdges;
}

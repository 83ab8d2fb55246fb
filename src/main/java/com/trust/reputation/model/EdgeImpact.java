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
@Schema(description = "Leave-one-out influence of a single edge on an audited node")
public class EdgeImpact {

    @Schema(description = "Position of the edge in the input edge list", example = "17")
    private int edgeIndex;

    @Schema(description = "Edge source", example = "did:trust:bob")
    private String source;

    @Schema(description = "Edge target", example = "did:trust:alice")
    private String target;

    @Schema(description = "Signed change of the audited graph score if this edge were removed", example = "-12.4")
    private double impact;

    @Schema(description = "Impact as a percentage of the base score", example = "-6.7")
    private double relativeImpact;
}

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
@Schema(description = "Directed, weighted, timestamped interaction between two nodes")
public class GraphEdge {

    @Schema(description = "Source node id", example = "did:trust:alice")
    private String source;

    @Schema(description = "Target node id", example = "did:trust:bob")
    private String target;

    @Schema(description = "Non-negative base weight", example = "0.9")
    private double weight;

    @Schema(description = "Interaction type", example = "ENDORSE")
    private EdgeType edgeType;

    @Schema(description = "Creation time in epoch millis", example = "1739886764000")
    private long timestamp;

    @Schema(description = "Edge attributes")
    private EdgeAttributes attributes;

    public EdgeAttributes attributesOrEmpty() {
        return attributes != null ? attributes : new EdgeAttributes();
    }
}

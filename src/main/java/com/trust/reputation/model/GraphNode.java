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
@Schema(description = "Account node in the trust graph snapshot")
public class GraphNode {

    @Schema(description = "Unique node identifier", example = "did:trust:alice")
    private String id;

    @Schema(description = "Economic and content attributes")
    private NodeAttributes attributes;

    /** Never null; nodes without attributes behave as all-zero. */
    public NodeAttributes attributesOrEmpty() {
        return attributes != null ? attributes : new NodeAttributes();
    }
}

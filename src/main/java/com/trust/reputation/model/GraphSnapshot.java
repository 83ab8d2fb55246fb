package com.trust.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * Immutable-by-contract input to one scoring run. Callers must not mutate the
 * lists while a run is in progress.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Node/edge snapshot of the trust graph")
public class GraphSnapshot {

    @Schema(description = "Graph nodes; ids must be unique")
    private List<GraphNode> nodes;

    @Schema(description = "Directed edges; parallel edges are kept and scored independently")
    private List<GraphEdge> edges;

    public List<GraphNode> nodesOrEmpty() {
        return nodes != null ? nodes : Collections.emptyList();
    }

    public List<GraphEdge> edgesOrEmpty() {
        return edges != null ? edges : Collections.emptyList();
    }
}

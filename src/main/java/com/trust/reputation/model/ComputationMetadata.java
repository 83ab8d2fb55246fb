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
@Schema(description = "Bookkeeping for one scoring run")
public class ComputationMetadata {

    @Schema(example = "120")
    private int nodeCount;

    @Schema(example = "640")
    private int edgeCount;

    @Schema(example = "TemporalWeightedPageRank")
    private String algorithm;

    @Schema(description = "Power iterations performed", example = "37")
    private int iterations;

    @Schema(description = "False when maxIterations was reached before convergence; scores are then the best available, not final", example = "true")
    private boolean converged;

    @Schema(description = "L1 delta of the last iteration", example = "8.1E-7")
    private double finalDelta;

    @Schema(example = "14")
    private long computationTimeMs;
}

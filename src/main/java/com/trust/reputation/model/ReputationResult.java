package com.trust.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Output of one scoring run. Sybil probabilities are ranked signals that need a
 * separate policy threshold; they are not a verdict that a node is a Sybil.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scores and diagnostics produced by one reputation run")
public class ReputationResult {

    @Schema(description = "Node id to score, in input node order")
    private Map<String, ReputationScore> scores;

    @Schema(description = "Distribution fairness diagnostics (null when disabled)")
    private FairnessMetrics fairnessMetrics;

    @Schema(description = "Node id to heuristic Sybil probability (0-1); null when disabled")
    private Map<String, Double> sybilProbabilities;

    @Schema(description = "Node id to leave-one-out sensitivity audit; null when disabled")
    private Map<String, SensitivityAudit> sensitivityAudits;

    @Schema(description = "Edge key (source->target#index) to deception probability; null when disabled")
    private Map<String, Double> deceptionProbabilities;

    @Schema(description = "Run metadata including convergence")
    private ComputationMetadata metadata;
}

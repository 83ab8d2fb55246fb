package com.trust.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Read-only result of one clustering run. The risk score is a heuristic ranking
 * signal, not proof of coordination.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Group of accounts with a similarity/connectivity relationship")
public class Cluster {

    @Schema(example = "cluster-0")
    private String clusterId;

    @Schema(description = "Member account ids, sorted")
    private List<String> accounts;

    @Schema(example = "20")
    private int size;

    @Schema(description = "Mean pairwise similarity", example = "0.81")
    private double density;

    @Schema(description = "Connected member pairs over all member pairs", example = "0.95")
    private double cohesion;

    @Schema(description = "Heuristic risk (0-1)", example = "0.9")
    private double riskScore;

    @Schema(description = "Qualitative tags", example = "[\"shared_email_domain\", \"low_reputation\"]")
    private List<String> patterns;
}

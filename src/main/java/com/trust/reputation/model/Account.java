package com.trust.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * Clustering input: raw account attributes merged with scorer output. Owned by a
 * single clustering run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Account record consumed by the clustering engine")
public class Account {

    @Schema(example = "acct-7")
    private String accountId;

    @Schema(description = "Reputation (typically the scorer's finalScore)", example = "212.5")
    private Double reputation;

    @Schema(description = "Scorer's heuristic Sybil probability", example = "0.15")
    private Double sybilProbability;

    @Schema(description = "Timestamped activity records")
    private List<Contribution> contributions;

    @Schema(description = "Outgoing connections")
    private List<Connection> connections;

    @Schema(description = "Profile attributes")
    private AccountAttributes attributes;

    public List<Contribution> contributionsOrEmpty() {
        return contributions != null ? contributions : Collections.emptyList();
    }

    public List<Connection> connectionsOrEmpty() {
        return connections != null ? connections : Collections.emptyList();
    }
}

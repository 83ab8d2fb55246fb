package com.trust.reputation.model;

import com.trust.reputation.config.ClusteringConfig;
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
@Schema(description = "Similarity-threshold sweep request")
public class TuningRequest {

    @Schema(description = "Accounts; ids must be unique")
    private List<Account> accounts;

    @Schema(description = "Per-run configuration; omit to use the server defaults")
    private ClusteringConfig config;

    @Schema(description = "Lowest threshold evaluated", example = "0.1")
    private Double minSimilarity;

    @Schema(description = "Highest threshold evaluated", example = "0.9")
    private Double maxSimilarity;

    @Schema(description = "Threshold increment", example = "0.1")
    private Double step;
}

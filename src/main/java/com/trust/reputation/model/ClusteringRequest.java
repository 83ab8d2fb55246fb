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
@Schema(description = "Accounts to cluster or compare")
public class ClusteringRequest {

    @Schema(description = "Accounts; ids must be unique")
    private List<Account> accounts;

    @Schema(description = "Per-run configuration; omit to use the server defaults")
    private ClusteringConfig config;
}

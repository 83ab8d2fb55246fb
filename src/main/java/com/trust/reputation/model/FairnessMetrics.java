package com.trust.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Diagnostic view of the score distribution. Not used to gate anything by itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Distribution fairness diagnostics for one scoring run")
public class FairnessMetrics {

    @Schema(description = "0 = perfectly equal, 1 = maximal inequality", example = "0.41")
    private double giniCoefficient;

    @Schema(description = "Minority share of the top decile relative to their population share", example = "0.8")
    private double minorityRepresentation;

    @Schema(description = "Normalized Shannon diversity of the top decile (0-1)", example = "0.72")
    private double topDecileDiversity;

    @Schema(description = "0 = no bias detected, 1 = maximal bias", example = "0.24")
    private double biasScore;

    public static FairnessMetrics empty() {
        return new FairnessMetrics(0.0, 0.0, 0.0, 0.0);
    }
}

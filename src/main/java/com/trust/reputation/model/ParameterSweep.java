package com.trust.reputation.model;

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
@Schema(description = "Result of a similarity-threshold sweep")
public class ParameterSweep {

    @Schema(example = "0.4")
    private double optimalSimilarity;

    private List<SweepMetric> metrics;
}

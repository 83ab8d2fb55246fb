package com.trust.reputation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Named edge attributes used to boost effective edge weight")
public class EdgeAttributes {

    @Schema(description = "Declared endorsement strength (0-1)", example = "0.8")
    private Double endorsementStrength;

    @Schema(description = "Edge is backed by stake", example = "true")
    private boolean stakeBacked;

    @Schema(description = "Payment amount carried by the edge", example = "1500")
    private Double paymentAmount;

    @Schema(description = "Edge has been verified", example = "true")
    private boolean verified;

    @Schema(description = "Open attributes consumed by pluggable extractors")
    private Map<String, Object> extensions;
}

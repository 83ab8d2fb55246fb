package com.trust.reputation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Economic and content signals attached to a graph node. Every field is optional;
 * absent values count as zero / not flagged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Named node attributes used by scoring and fairness auditing")
public class NodeAttributes {

    @Schema(description = "Economic commitment (staked amount)", example = "5000")
    private Double stake;

    @Schema(description = "Cumulative verified payment volume", example = "25000")
    private Double paymentHistory;

    @Schema(description = "Count of verified endorsements", example = "4")
    private Integer verifiedEndorsements;

    @Schema(description = "Content quality rating (0-100)", example = "72")
    private Double contentQuality;

    @Schema(description = "Epoch millis of last activity", example = "1739886764000")
    private Long activityRecency;

    @Schema(description = "Member of a group tracked for fairness auditing", example = "false")
    private Boolean minorityGroup;

    @Schema(description = "Open attributes consumed by pluggable extractors")
    private Map<String, Object> extensions;

    public double stakeOrZero() {
        return stake != null ? stake : 0.0;
    }

    public double paymentHistoryOrZero() {
        return paymentHistory != null ? paymentHistory : 0.0;
    }

    public int verifiedEndorsementsOrZero() {
        return verifiedEndorsements != null ? verifiedEndorsements : 0;
    }

    public double contentQualityOrZero() {
        return contentQuality != null ? contentQuality : 0.0;
    }

    @JsonIgnore
    public boolean isMinority() {
        return Boolean.TRUE.equals(minorityGroup);
    }
}

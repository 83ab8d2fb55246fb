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
@Schema(description = "Similarity of two accounts with its feature breakdown")
public class AccountPair {

    @Schema(example = "acct-1")
    private String account1;

    @Schema(example = "acct-2")
    private String account2;

    @Schema(description = "Weighted similarity (0-1)", example = "0.62")
    private double similarity;

    private PairFeatures features;
}

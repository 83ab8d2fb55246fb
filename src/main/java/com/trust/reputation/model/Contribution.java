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
@Schema(description = "Timestamped activity record of an account")
public class Contribution {

    @Schema(example = "1739886764000")
    private long timestamp;

    @Schema(description = "Chain block height, when the activity was anchored", example = "18234001")
    private long block;

    @Schema(example = "commit")
    private String type;
}

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
@Schema(description = "Outgoing connection of an account")
public class Connection {

    @Schema(example = "acct-42")
    private String target;

    @Schema(example = "0.7")
    private double weight;
}

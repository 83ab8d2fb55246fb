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
@Schema(description = "Profile attributes compared by the metadata similarity feature")
public class AccountAttributes {

    @Schema(example = "mailinator.com")
    private String emailDomain;

    @Schema(description = "Registration time in epoch millis", example = "1735689600000")
    private Long registrationDate;

    @Schema(example = "0.4")
    private Double activityLevel;

    @Schema(example = "0")
    private Double stake;

    @Schema(example = "0")
    private Double paymentHistory;

    @Schema(description = "Open attributes; strings, numbers and booleans are compared")
    private Map<String, Object> extensions;
}

package com.flagship.pool_settlement.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class FactoringApprovalRequest {

    @Min(0) @Max(10_000)
    @JsonProperty("yield_bps")
    int yieldBps;
}

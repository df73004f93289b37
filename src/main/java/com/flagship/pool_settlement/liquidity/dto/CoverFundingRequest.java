package com.flagship.pool_settlement.liquidity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class CoverFundingRequest {

    @NotBlank(message = "Provider ID is required")
    @JsonProperty("provider_id")
    String providerId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.000001", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;
}

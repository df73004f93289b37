package com.flagship.pool_settlement.liquidity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Request body carrying a single amount (profit, loss, recovery, fee withdrawal).
 */
@Value
@Builder
@Jacksonized
public class AmountRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.000001", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;
}

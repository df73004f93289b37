package com.flagship.pool_settlement.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Drawdown or payment amount, optionally tied to a receivable.
 */
@Value
@Builder
@Jacksonized
public class CreditAmountRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.000001", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("receivable_id")
    String receivableId;
}

package com.flagship.pool_settlement.redemption.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Lender request carrying assets (deposit) or shares (redemption request, cancellation).
 */
@Value
@Builder
@Jacksonized
public class LenderAmountRequest {

    @NotBlank(message = "Lender ID is required")
    @JsonProperty("lender_id")
    String lenderId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.000001", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;
}

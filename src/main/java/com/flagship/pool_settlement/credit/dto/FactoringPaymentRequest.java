package com.flagship.pool_settlement.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Payment on a factored receivable, made by the borrower or the receivable's debtor.
 */
@Value
@Builder
@Jacksonized
public class FactoringPaymentRequest {

    @NotBlank(message = "Payer ID is required")
    @JsonProperty("payer_id")
    String payerId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.000001", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;
}

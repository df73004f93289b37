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
 * Principal payment against one receivable combined with a drawdown against another.
 */
@Value
@Builder
@Jacksonized
public class PrincipalPaymentAndDrawdownRequest {

    @NotBlank(message = "Payment receivable is required")
    @JsonProperty("payment_receivable_id")
    String paymentReceivableId;

    @NotNull(message = "Payment amount is required")
    @DecimalMin(value = "0.000001", message = "Payment amount must be greater than 0")
    @JsonProperty("payment_amount")
    BigDecimal paymentAmount;

    @NotBlank(message = "Drawdown receivable is required")
    @JsonProperty("drawdown_receivable_id")
    String drawdownReceivableId;

    @NotNull(message = "Drawdown amount is required")
    @DecimalMin(value = "0.000001", message = "Drawdown amount must be greater than 0")
    @JsonProperty("drawdown_amount")
    BigDecimal drawdownAmount;
}

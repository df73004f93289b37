package com.flagship.pool_settlement.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pool_settlement.calendar.PayPeriodDuration;
import com.flagship.pool_settlement.credit.CreditConfig;
import com.flagship.pool_settlement.credit.CreditType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Request DTO for approving a credit line or receivable backed credit line.
 */
@Value
@Builder
@Jacksonized
public class ApproveBorrowerRequest {

    @NotBlank(message = "Borrower ID is required")
    @JsonProperty("borrower_id")
    String borrowerId;

    @NotNull(message = "Credit type is required")
    @JsonProperty("credit_type")
    CreditType creditType;

    @NotNull(message = "Credit limit is required")
    @DecimalMin(value = "0.000001", message = "Credit limit must be greater than 0")
    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @DecimalMin(value = "0", message = "Committed amount must not be negative")
    @JsonProperty("committed_amount")
    BigDecimal committedAmount;

    @Min(0) @Max(10_000)
    @JsonProperty("yield_bps")
    int yieldBps;

    @Min(value = 1, message = "At least one period is required")
    @JsonProperty("num_of_periods")
    int numOfPeriods;

    @JsonProperty("revolving")
    boolean revolving;

    public CreditConfig toCreditConfig(PayPeriodDuration payPeriodDuration) {
        return CreditConfig.builder()
            .creditLimit(creditLimit)
            .committedAmount(committedAmount == null ? BigDecimal.ZERO : committedAmount)
            .yieldBps(yieldBps)
            .numOfPeriods(numOfPeriods)
            .payPeriodDuration(payPeriodDuration)
            .revolving(revolving)
            .build();
    }
}

package com.flagship.pool_settlement.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pool_settlement.credit.CreditRecord;
import com.flagship.pool_settlement.credit.CreditState;
import com.flagship.pool_settlement.credit.CreditType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Response DTO for a credit's bill and status.
 */
@Value
@Builder
public class CreditResponse {

    @JsonProperty("credit_id")
    String creditId;

    @JsonProperty("borrower_id")
    String borrowerId;

    @JsonProperty("credit_type")
    CreditType creditType;

    @JsonProperty("receivable_id")
    String receivableId;

    @JsonProperty("state")
    CreditState state;

    @JsonProperty("available_credit")
    BigDecimal availableCredit;

    @JsonProperty("unbilled_principal")
    BigDecimal unbilledPrincipal;

    @JsonProperty("next_due")
    BigDecimal nextDue;

    @JsonProperty("yield_due")
    BigDecimal yieldDue;

    @JsonProperty("past_due")
    BigDecimal pastDue;

    @JsonProperty("late_fee")
    BigDecimal lateFee;

    @JsonProperty("payoff_amount")
    BigDecimal payoffAmount;

    @JsonProperty("next_due_date")
    LocalDate nextDueDate;

    @JsonProperty("maturity_date")
    LocalDate maturityDate;

    @JsonProperty("missed_periods")
    int missedPeriods;

    @JsonProperty("remaining_periods")
    int remainingPeriods;

    public static CreditResponse from(CreditRecord record, BigDecimal availableCredit) {
        return CreditResponse.builder()
            .creditId(record.getCreditId())
            .borrowerId(record.getBorrowerId())
            .creditType(record.getCreditType())
            .receivableId(record.getReceivableId())
            .state(record.getState())
            .availableCredit(availableCredit)
            .unbilledPrincipal(record.getUnbilledPrincipal())
            .nextDue(record.getNextDue())
            .yieldDue(record.getYieldDue())
            .pastDue(record.getPastDue())
            .lateFee(record.getDueDetail().getLateFee())
            .payoffAmount(record.getPayoffAmount())
            .nextDueDate(record.getNextDueDate())
            .maturityDate(record.getMaturityDate())
            .missedPeriods(record.getMissedPeriods())
            .remainingPeriods(record.getRemainingPeriods())
            .build();
    }
}

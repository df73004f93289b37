package com.flagship.pool_settlement.redemption;

import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Per lender redemption state of one tranche.
 *
 * The record is settled lazily: sealed epoch summaries since
 * {@code lastUpdatedEpochId} are folded in when the lender next interacts
 * with the vault, each one processing the lender's outstanding shares pro rata.
 */
@Value
@Builder(toBuilder = true)
public class LenderRedemptionRecord {
    long lastUpdatedEpochId;
    BigDecimal sharesRequested;
    BigDecimal totalSharesProcessed;
    BigDecimal totalAmountProcessed;
    BigDecimal totalAmountWithdrawn;

    public static LenderRedemptionRecord empty(long epochId) {
        return LenderRedemptionRecord.builder()
            .lastUpdatedEpochId(epochId)
            .sharesRequested(Amounts.ZERO)
            .totalSharesProcessed(Amounts.ZERO)
            .totalAmountProcessed(Amounts.ZERO)
            .totalAmountWithdrawn(Amounts.ZERO)
            .build();
    }

    /**
     * Folds one sealed summary into the record.
     */
    public LenderRedemptionRecord apply(EpochRedemptionSummary summary) {
        if (!summary.isSealed() || summary.getEpochId() < lastUpdatedEpochId) {
            throw new IllegalArgumentException("Cannot apply summary of epoch " + summary.getEpochId()
                + " to a record at epoch " + lastUpdatedEpochId);
        }
        LenderRedemptionRecordBuilder next = toBuilder().lastUpdatedEpochId(summary.getEpochId() + 1);
        if (sharesRequested.signum() == 0 || summary.getTotalSharesProcessed().signum() == 0) {
            return next.build();
        }

        // Shares round up and amounts round down, so the outstanding shares of all lenders
        // never exceed the carried over requests and their amounts never exceed the reserve.
        BigDecimal sharesProcessed = summary.isFullyProcessed()
            ? sharesRequested
            : Amounts.min(sharesRequested, Amounts.mulDivUp(sharesRequested, summary.getTotalSharesProcessed(),
                summary.getTotalSharesRequested()));
        BigDecimal amountProcessed = Amounts.mulDiv(sharesRequested, summary.getTotalAmountProcessed(),
            summary.getTotalSharesRequested());

        return next
            .sharesRequested(sharesRequested.subtract(sharesProcessed))
            .totalSharesProcessed(totalSharesProcessed.add(sharesProcessed))
            .totalAmountProcessed(totalAmountProcessed.add(amountProcessed))
            .build();
    }

    public LenderRedemptionRecord withRequest(BigDecimal shares) {
        return toBuilder().sharesRequested(sharesRequested.add(shares)).build();
    }

    public LenderRedemptionRecord withCancellation(BigDecimal shares) {
        if (shares.compareTo(sharesRequested) > 0) {
            throw new IllegalArgumentException(String.format(
                "Cannot cancel %s shares, only %s outstanding", shares, sharesRequested));
        }
        return toBuilder().sharesRequested(sharesRequested.subtract(shares)).build();
    }

    public LenderRedemptionRecord withWithdrawal(BigDecimal amount) {
        return toBuilder().totalAmountWithdrawn(totalAmountWithdrawn.add(amount)).build();
    }

    public BigDecimal getWithdrawableAmount() {
        return totalAmountProcessed.subtract(totalAmountWithdrawn);
    }
}

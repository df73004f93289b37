package com.flagship.pool_settlement.redemption;

import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Redemption totals of one tranche for one epoch. Open while the epoch runs,
 * sealed when it closes.
 */
@Value
public class EpochRedemptionSummary {
    long epochId;
    BigDecimal totalSharesRequested;
    BigDecimal totalSharesProcessed;
    BigDecimal totalAmountProcessed;
    boolean sealed;

    public static EpochRedemptionSummary open(long epochId, BigDecimal carriedOverShares) {
        return new EpochRedemptionSummary(epochId, Amounts.scale(carriedOverShares), Amounts.ZERO, Amounts.ZERO,
            false);
    }

    public EpochRedemptionSummary withAdditionalRequest(BigDecimal shares) {
        requireOpen();
        return new EpochRedemptionSummary(epochId, totalSharesRequested.add(shares), totalSharesProcessed,
            totalAmountProcessed, false);
    }

    /**
     * Shrinks the request total, never below zero.
     */
    public EpochRedemptionSummary withCancelledRequest(BigDecimal shares) {
        requireOpen();
        BigDecimal remaining = Amounts.max(Amounts.ZERO, totalSharesRequested.subtract(shares));
        return new EpochRedemptionSummary(epochId, remaining, totalSharesProcessed, totalAmountProcessed, false);
    }

    public EpochRedemptionSummary seal(BigDecimal sharesProcessed, BigDecimal amountProcessed) {
        requireOpen();
        if (sharesProcessed.compareTo(totalSharesRequested) > 0) {
            throw new IllegalStateException(String.format(
                "Epoch %d: processed shares %s exceed requested %s", epochId, sharesProcessed,
                totalSharesRequested));
        }
        return new EpochRedemptionSummary(epochId, totalSharesRequested, Amounts.scale(sharesProcessed),
            Amounts.scale(amountProcessed), true);
    }

    public BigDecimal getUnprocessedShares() {
        return totalSharesRequested.subtract(totalSharesProcessed);
    }

    public boolean isFullyProcessed() {
        return totalSharesProcessed.compareTo(totalSharesRequested) == 0;
    }

    private void requireOpen() {
        if (sealed) {
            throw new IllegalStateException("Redemption summary of epoch " + epochId + " is sealed");
        }
    }
}

package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A senior/junior pair of amounts: balances, losses, or one operation's split.
 */
@Value
public class TrancheAssets {

    public static final TrancheAssets ZERO = new TrancheAssets(Amounts.ZERO, Amounts.ZERO);

    BigDecimal senior;
    BigDecimal junior;

    public static TrancheAssets of(BigDecimal senior, BigDecimal junior) {
        return new TrancheAssets(Amounts.scale(senior), Amounts.scale(junior));
    }

    public BigDecimal get(Tranche tranche) {
        return tranche == Tranche.SENIOR ? senior : junior;
    }

    public TrancheAssets with(Tranche tranche, BigDecimal amount) {
        return tranche == Tranche.SENIOR ? of(amount, junior) : of(senior, amount);
    }

    public TrancheAssets plus(TrancheAssets other) {
        return of(senior.add(other.senior), junior.add(other.junior));
    }

    public TrancheAssets minus(TrancheAssets other) {
        return of(senior.subtract(other.senior), junior.subtract(other.junior));
    }

    public BigDecimal total() {
        return senior.add(junior);
    }
}

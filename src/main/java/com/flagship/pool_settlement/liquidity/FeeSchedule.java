package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Rates applied to every profit distribution.
 *
 * The flat fee and protocol fee come off the gross profit; pool owner and
 * evaluation agent rewards are taken from what remains.
 */
@Value
@Builder
public class FeeSchedule {
    int protocolFeeBps;
    int poolOwnerRewardBps;
    int eaRewardBps;
    BigDecimal flatFee;

    public static FeeSchedule from(PoolProperties.Fees fees) {
        return FeeSchedule.builder()
            .protocolFeeBps(fees.getProtocolFeeBps())
            .poolOwnerRewardBps(fees.getPoolOwnerRewardBps())
            .eaRewardBps(fees.getEaRewardBps())
            .flatFee(fees.getFlatFee())
            .build()
            .validate();
    }

    public FeeSchedule validate() {
        checkBps(protocolFeeBps, "protocolFeeBps");
        checkBps(poolOwnerRewardBps, "poolOwnerRewardBps");
        checkBps(eaRewardBps, "eaRewardBps");
        if (poolOwnerRewardBps + eaRewardBps > 10_000) {
            throw new IllegalArgumentException("Pool owner and evaluation agent rewards exceed 100%");
        }
        Amounts.requireNonNegative(flatFee, "flatFee");
        return this;
    }

    private static void checkBps(int value, String name) {
        if (value < 0 || value > 10_000) {
            throw new IllegalArgumentException(name + " must be between 0 and 10000");
        }
    }
}

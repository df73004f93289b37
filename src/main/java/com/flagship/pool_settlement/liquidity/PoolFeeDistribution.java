package com.flagship.pool_settlement.liquidity;

import com.flagship.pool_settlement.ledger.Amounts;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class PoolFeeDistribution {

    public static final PoolFeeDistribution NONE =
        new PoolFeeDistribution(Amounts.ZERO, Amounts.ZERO, Amounts.ZERO, Amounts.ZERO);

    BigDecimal protocolFee;
    BigDecimal poolOwnerFee;
    BigDecimal eaFee;
    BigDecimal netProfit;

    public BigDecimal totalFees() {
        return protocolFee.add(poolOwnerFee).add(eaFee);
    }

    public BigDecimal get(FeeRecipient recipient) {
        return switch (recipient) {
            case PROTOCOL -> protocolFee;
            case POOL_OWNER -> poolOwnerFee;
            case EVALUATION_AGENT -> eaFee;
        };
    }
}

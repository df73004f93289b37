package com.flagship.pool_settlement.exception;

/**
 * Deposit would push the pool past its liquidity cap or the senior tranche past
 * the allowed senior/junior ratio.
 */
public class LiquidityCapExceededException extends PoolException {

    public LiquidityCapExceededException(String message) {
        super(PoolErrorCode.LIQUIDITY_CAP_EXCEEDED, message);
    }
}

package com.flagship.pool_settlement.exception;

/**
 * An internal custody account does not hold enough funds for a transfer.
 */
public class InsufficientLiquidityException extends PoolException {

    public InsufficientLiquidityException(String message) {
        super(PoolErrorCode.INSUFFICIENT_LIQUIDITY, message);
    }
}

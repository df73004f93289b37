package com.flagship.pool_settlement.exception;

/**
 * Drawdown larger than the credit's available amount.
 */
public class InsufficientCreditException extends PoolException {

    public InsufficientCreditException(String message) {
        super(PoolErrorCode.INSUFFICIENT_CREDIT, message);
    }
}

package com.flagship.pool_settlement.exception;

/**
 * Drawdown after the credit's maturity, or against a receivable that has already matured.
 */
public class MaturityExceededException extends PoolException {

    public MaturityExceededException(String message) {
        super(PoolErrorCode.MATURITY_EXCEEDED, message);
    }
}

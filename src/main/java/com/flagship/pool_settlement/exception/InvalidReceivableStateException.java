package com.flagship.pool_settlement.exception;

public class InvalidReceivableStateException extends PoolException {

    public InvalidReceivableStateException(String message) {
        super(PoolErrorCode.INVALID_RECEIVABLE_STATE, message);
    }
}

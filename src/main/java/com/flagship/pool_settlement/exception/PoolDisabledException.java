package com.flagship.pool_settlement.exception;

public class PoolDisabledException extends PoolException {

    public PoolDisabledException(String message) {
        super(PoolErrorCode.POOL_DISABLED, message);
    }
}

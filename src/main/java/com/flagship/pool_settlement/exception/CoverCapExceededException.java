package com.flagship.pool_settlement.exception;

public class CoverCapExceededException extends PoolException {

    public CoverCapExceededException(String message) {
        super(PoolErrorCode.COVER_CAP_EXCEEDED, message);
    }
}

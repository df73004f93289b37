package com.flagship.pool_settlement.exception;

public class ResourceNotFoundException extends PoolException {

    public ResourceNotFoundException(String message) {
        super(PoolErrorCode.NOT_FOUND, message);
    }
}

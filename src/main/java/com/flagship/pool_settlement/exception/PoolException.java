package com.flagship.pool_settlement.exception;

import lombok.Getter;

/**
 * Base class for business failures. Any PoolException thrown inside an
 * operation rolls the whole operation back.
 */
@Getter
public class PoolException extends RuntimeException {

    private final PoolErrorCode errorCode;

    public PoolException(PoolErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}

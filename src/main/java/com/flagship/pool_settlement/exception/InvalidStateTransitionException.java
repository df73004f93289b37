package com.flagship.pool_settlement.exception;

public class InvalidStateTransitionException extends PoolException {

    public InvalidStateTransitionException(String message) {
        super(PoolErrorCode.INVALID_STATE_TRANSITION, message);
    }
}

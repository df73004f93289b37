package com.flagship.pool_settlement.exception;

/**
 * Caller is not the borrower, lender or receivable owner the operation requires.
 */
public class UnauthorizedException extends PoolException {

    public UnauthorizedException(String message) {
        super(PoolErrorCode.UNAUTHORIZED, message);
    }
}

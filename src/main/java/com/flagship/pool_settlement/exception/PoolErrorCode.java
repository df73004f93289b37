package com.flagship.pool_settlement.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error taxonomy surfaced by pool operations, with the HTTP status the API maps each to.
 */
@Getter
@RequiredArgsConstructor
public enum PoolErrorCode {
    INSUFFICIENT_CREDIT(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_RECEIVABLE_STATE(HttpStatus.CONFLICT),
    MATURITY_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    POOL_DISABLED(HttpStatus.SERVICE_UNAVAILABLE),
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    INSUFFICIENT_LIQUIDITY(HttpStatus.UNPROCESSABLE_ENTITY),
    COVER_CAP_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    LIQUIDITY_CAP_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    INVALID_STATE_TRANSITION(HttpStatus.CONFLICT),
    EPOCH_IN_PROGRESS(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;
}

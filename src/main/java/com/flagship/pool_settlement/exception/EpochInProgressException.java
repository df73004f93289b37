package com.flagship.pool_settlement.exception;

/**
 * Epoch close attempted before the epoch's end, or while another close is running.
 */
public class EpochInProgressException extends PoolException {

    public EpochInProgressException(String message) {
        super(PoolErrorCode.EPOCH_IN_PROGRESS, message);
    }
}

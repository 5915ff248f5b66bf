package com.vestlock.domain.exception;

/**
 * Failure taxonomy of the lock ledger
 */
public enum LedgerErrorCode {
    DUPLICATE_ID,
    NOT_FOUND,
    UNAUTHORIZED,
    LOCK_PERIOD_ONGOING,
    TRANSFER_FAILED
}

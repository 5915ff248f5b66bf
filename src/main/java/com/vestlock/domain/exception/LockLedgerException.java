package com.vestlock.domain.exception;

import com.vestlock.domain.model.LockId;
import lombok.Getter;

/**
 * Raised (as a failed Future) by every ledger operation that cannot complete.
 * Never retried by the ledger itself.
 */
@Getter
public class LockLedgerException extends RuntimeException {

    private final LedgerErrorCode code;
    private final LockId lockId;
    /** True when the record is already gone but its custody could not be released. */
    private final boolean custodyStranded;

    private LockLedgerException(LedgerErrorCode code, LockId lockId, String message,
                                boolean custodyStranded, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.lockId = lockId;
        this.custodyStranded = custodyStranded;
    }

    public static LockLedgerException duplicateId(LockId lockId) {
        return new LockLedgerException(LedgerErrorCode.DUPLICATE_ID, lockId,
                "Lock id already in use: " + lockId, false, null);
    }

    public static LockLedgerException notFound(LockId lockId) {
        return new LockLedgerException(LedgerErrorCode.NOT_FOUND, lockId,
                "Lock not found: " + lockId, false, null);
    }

    public static LockLedgerException unauthorized(LockId lockId, String caller) {
        return new LockLedgerException(LedgerErrorCode.UNAUTHORIZED, lockId,
                "Caller " + caller + " is not the owner of lock " + lockId, false, null);
    }

    public static LockLedgerException lockPeriodOngoing(LockId lockId, long maturityEpochSecond) {
        return new LockLedgerException(LedgerErrorCode.LOCK_PERIOD_ONGOING, lockId,
                "Lock " + lockId + " matures at " + maturityEpochSecond, false, null);
    }

    public static LockLedgerException transferFailed(LockId lockId, Throwable cause) {
        return new LockLedgerException(LedgerErrorCode.TRANSFER_FAILED, lockId,
                "Asset transfer failed for lock " + lockId + ": " + cause.getMessage(), false, cause);
    }

    public static LockLedgerException custodyStranded(LockId lockId, Throwable cause) {
        return new LockLedgerException(LedgerErrorCode.TRANSFER_FAILED, lockId,
                "Lock " + lockId + " was withdrawn but its custody could not be released: "
                        + cause.getMessage(), true, cause);
    }

    public static boolean hasCode(Throwable error, LedgerErrorCode code) {
        return error instanceof LockLedgerException
                && ((LockLedgerException) error).getCode() == code;
    }
}

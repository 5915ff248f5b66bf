package com.vestlock.application.port.out;

import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;

/**
 * Output port to the external ledger of transferable positions.
 * Transfer and approval mechanics live behind this port, not in the ledger.
 */
public interface OwnershipRegistry {

    /**
     * Current holder of the position wrapping the lock
     * @return failed if the registry knows no such position
     */
    Future<String> ownerOf(LockId id);

    /**
     * Mint the position for a freshly created lock
     */
    Future<Void> register(LockId id, String owner);

    /**
     * Burn the position of a withdrawn lock
     */
    Future<Void> release(LockId id);

    /**
     * Units of the position held by an account (0 when none)
     */
    Future<Long> unitsHeld(LockId id, String holder);
}

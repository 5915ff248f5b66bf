package com.vestlock.application.port.out;

import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.Lock;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Output port for lock record storage
 * Only ACTIVE locks are readable; removed ids stay retired forever.
 */
public interface LockRepository {

    /**
     * Store a new lock
     * @return failed with DUPLICATE_ID if the id is live or was used before
     */
    Future<Void> create(Lock lock);

    /**
     * @return the ACTIVE lock, failed with NOT_FOUND otherwise
     */
    Future<Lock> get(LockId id);

    /**
     * Remove (or tombstone) a lock. A later get() reports NOT_FOUND.
     * @return failed with NOT_FOUND if no ACTIVE lock has this id
     */
    Future<Void> remove(LockId id);

    /**
     * Whether the id is live or retired; used for collision checks when deriving ids
     */
    Future<Boolean> isKnown(LockId id);

    /**
     * Largest live or retired id that fits in the given number of bits, if any.
     * Lets a counter-based id source resume after a restart.
     */
    Future<Optional<LockId>> highestIdWithin(int maxBits);

    /**
     * ACTIVE locks of an owner, oldest first
     */
    Future<List<Lock>> findByOwner(String owner);

    /**
     * Sum of the amounts of all ACTIVE locks in the given asset
     */
    Future<BigInteger> totalLocked(AssetRef asset);

    /**
     * Assets of all ACTIVE locks
     */
    Future<Set<AssetRef>> lockedAssets();
}

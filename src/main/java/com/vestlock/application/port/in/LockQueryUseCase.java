package com.vestlock.application.port.in;

import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Inbound port - valuation and maturity queries over locks.
 * Every query against an absent or withdrawn lock fails with NOT_FOUND.
 */
public interface LockQueryUseCase {

    /**
     * Asset the lock is denominated in
     */
    Future<AssetRef> getAsset(LockId id);

    /**
     * Currently vested value of one unit of the position
     */
    Future<BigInteger> getBalance(LockId id);

    /**
     * Instant at which the lock becomes withdrawable.
     * NOT_FOUND is reported as a failure, never as the epoch.
     */
    Future<Instant> getMaturity(LockId id);

    /**
     * Full snapshot of a lock including its current value
     */
    Future<LockSnapshot> getLock(LockId id);

    /**
     * Snapshots of the ACTIVE locks of an owner
     */
    Future<List<LockSnapshot>> findByOwner(String owner);

    /**
     * Value held by an account: per-unit balance times the units the ownership registry reports
     */
    Future<BigInteger> getHoldingValue(LockId id, String holder);

    /**
     * Read model of a lock at a given instant
     */
    record LockSnapshot(
            LockId id,
            String owner,
            AssetRef asset,
            BigInteger amount,
            Instant creationTime,
            long durationSeconds,
            Instant maturity,
            BigInteger vestedValue,
            boolean matured,
            Instant valuedAt
    ) {}
}

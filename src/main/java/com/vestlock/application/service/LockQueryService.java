package com.vestlock.application.service;

import com.vestlock.application.port.in.LockQueryUseCase;
import com.vestlock.application.port.out.LockRepository;
import com.vestlock.application.port.out.OwnershipRegistry;
import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.Lock;
import com.vestlock.domain.model.LockId;
import com.vestlock.domain.vesting.LinearVestingValuator;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Use case implementation for valuation and maturity queries
 * Read-only: goes straight to the repository, never through the lifecycle sequencer
 */
@Slf4j
public class LockQueryService implements LockQueryUseCase {

    private final LockRepository lockRepository;
    private final OwnershipRegistry ownershipRegistry;
    private final Clock clock;

    /**
     * @param ownershipRegistry registry of transferable positions, or null when the
     *                          record owner holds the single unit of each lock
     */
    public LockQueryService(LockRepository lockRepository, OwnershipRegistry ownershipRegistry, Clock clock) {
        this.lockRepository = lockRepository;
        this.ownershipRegistry = ownershipRegistry;
        this.clock = clock;
    }

    @Override
    public Future<AssetRef> getAsset(LockId id) {
        return lockRepository.get(id).map(Lock::getAsset);
    }

    @Override
    public Future<BigInteger> getBalance(LockId id) {
        Instant now = now();
        return lockRepository.get(id)
                .map(lock -> LinearVestingValuator.value(lock, now))
                .onSuccess(value -> log.debug("Balance of lock {} at {}: {}", id, now, value));
    }

    @Override
    public Future<Instant> getMaturity(LockId id) {
        return lockRepository.get(id).map(Lock::getMaturity);
    }

    @Override
    public Future<LockSnapshot> getLock(LockId id) {
        Instant now = now();
        return lockRepository.get(id).map(lock -> snapshot(lock, now));
    }

    @Override
    public Future<List<LockSnapshot>> findByOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            return Future.failedFuture(new IllegalArgumentException("owner is required"));
        }
        Instant now = now();
        return lockRepository.findByOwner(owner)
                .map(locks -> locks.stream()
                        .map(lock -> snapshot(lock, now))
                        .collect(Collectors.toList()))
                .onSuccess(snapshots -> log.debug("Found {} locks for owner {}", snapshots.size(), owner));
    }

    @Override
    public Future<BigInteger> getHoldingValue(LockId id, String holder) {
        if (holder == null || holder.isBlank()) {
            return Future.failedFuture(new IllegalArgumentException("holder is required"));
        }
        Instant now = now();
        return lockRepository.get(id)
                .compose(lock -> unitsHeld(lock, holder)
                        .map(units -> LinearVestingValuator.value(lock, now, units)));
    }

    private Future<Long> unitsHeld(Lock lock, String holder) {
        if (ownershipRegistry == null) {
            return Future.succeededFuture(holder.equals(lock.getOwner()) ? 1L : 0L);
        }
        return ownershipRegistry.unitsHeld(lock.getId(), holder);
    }

    private LockSnapshot snapshot(Lock lock, Instant now) {
        return new LockSnapshot(
                lock.getId(),
                lock.getOwner(),
                lock.getAsset(),
                lock.getAmount(),
                lock.getCreationTime(),
                lock.getDuration().getSeconds(),
                lock.getMaturity(),
                LinearVestingValuator.value(lock, now),
                lock.isMatured(now),
                now
        );
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}

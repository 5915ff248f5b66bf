package com.vestlock.adapter.out.persistence;

import com.vestlock.application.port.out.LockRepository;
import com.vestlock.domain.exception.LockLedgerException;
import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.Lock;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of LockRepository over an injected map.
 * Removed ids move to a retired set and can never be created again.
 */
@Slf4j
public class InMemoryLockPersistenceAdapter implements LockRepository {

    private final Map<LockId, Lock> locks;
    private final Set<LockId> retired = ConcurrentHashMap.newKeySet();

    public InMemoryLockPersistenceAdapter() {
        this(new ConcurrentHashMap<>());
    }

    public InMemoryLockPersistenceAdapter(Map<LockId, Lock> backingMap) {
        this.locks = backingMap;
    }

    @Override
    public synchronized Future<Void> create(Lock lock) {
        LockId id = lock.getId();
        if (retired.contains(id) || locks.containsKey(id)) {
            log.warn("Rejected duplicate lock id {}", id);
            return Future.failedFuture(LockLedgerException.duplicateId(id));
        }
        locks.put(id, lock);
        log.debug("Stored lock {}", id);
        return Future.succeededFuture();
    }

    @Override
    public Future<Lock> get(LockId id) {
        Lock lock = locks.get(id);
        if (lock == null) {
            return Future.failedFuture(LockLedgerException.notFound(id));
        }
        return Future.succeededFuture(lock);
    }

    @Override
    public synchronized Future<Void> remove(LockId id) {
        Lock removed = locks.remove(id);
        if (removed == null) {
            return Future.failedFuture(LockLedgerException.notFound(id));
        }
        retired.add(id);
        log.debug("Removed lock {}", id);
        return Future.succeededFuture();
    }

    @Override
    public Future<Boolean> isKnown(LockId id) {
        return Future.succeededFuture(locks.containsKey(id) || retired.contains(id));
    }

    @Override
    public synchronized Future<Optional<LockId>> highestIdWithin(int maxBits) {
        Optional<LockId> highest = Stream.concat(locks.keySet().stream(), retired.stream())
                .filter(id -> id.value().bitLength() <= maxBits)
                .max(LockId::compareTo);
        return Future.succeededFuture(highest);
    }

    @Override
    public Future<List<Lock>> findByOwner(String owner) {
        List<Lock> result = locks.values().stream()
                .filter(lock -> owner.equals(lock.getOwner()))
                .sorted(Comparator.comparing(Lock::getCreationTime).thenComparing(Lock::getId))
                .collect(Collectors.toList());
        return Future.succeededFuture(result);
    }

    @Override
    public Future<BigInteger> totalLocked(AssetRef asset) {
        BigInteger total = locks.values().stream()
                .filter(lock -> asset.equals(lock.getAsset()))
                .map(Lock::getAmount)
                .reduce(BigInteger.ZERO, BigInteger::add);
        return Future.succeededFuture(total);
    }

    @Override
    public Future<Set<AssetRef>> lockedAssets() {
        return Future.succeededFuture(locks.values().stream()
                .map(Lock::getAsset)
                .collect(Collectors.toSet()));
    }
}

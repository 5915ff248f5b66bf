package com.vestlock.adapter.out.registry;

import com.vestlock.application.port.out.OwnershipRegistry;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory OwnershipRegistry: one non-fungible unit per lock position
 */
@Slf4j
public class InMemoryPositionRegistryAdapter implements OwnershipRegistry {

    private final Map<LockId, String> holders = new ConcurrentHashMap<>();

    @Override
    public Future<String> ownerOf(LockId id) {
        String holder = holders.get(id);
        if (holder == null) {
            return Future.failedFuture(new IllegalStateException("No position registered for lock " + id));
        }
        return Future.succeededFuture(holder);
    }

    @Override
    public Future<Void> register(LockId id, String owner) {
        String previous = holders.putIfAbsent(id, owner);
        if (previous != null) {
            return Future.failedFuture(new IllegalStateException("Position already registered for lock " + id));
        }
        log.debug("Registered position {} to {}", id, owner);
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> release(LockId id) {
        if (holders.remove(id) == null) {
            return Future.failedFuture(new IllegalStateException("No position registered for lock " + id));
        }
        log.debug("Released position {}", id);
        return Future.succeededFuture();
    }

    @Override
    public Future<Long> unitsHeld(LockId id, String holder) {
        return Future.succeededFuture(holder.equals(holders.get(id)) ? 1L : 0L);
    }

    /**
     * Move a position to a new holder, as the external token ledger would on transfer
     */
    public Future<Void> reassign(LockId id, String from, String to) {
        if (!holders.replace(id, from, to)) {
            return Future.failedFuture(new IllegalStateException(from + " does not hold position " + id));
        }
        log.info("Position {} moved from {} to {}", id, from, to);
        return Future.succeededFuture();
    }
}

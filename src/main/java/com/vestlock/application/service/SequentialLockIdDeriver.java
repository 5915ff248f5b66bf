package com.vestlock.application.service;

import com.vestlock.application.port.out.LockRepository;
import com.vestlock.domain.exception.LockLedgerException;
import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out ids from a monotonically increasing counter.
 * On startup the counter resumes past the highest id already stored; ids still found
 * in the repository later on are skipped.
 */
@Slf4j
public class SequentialLockIdDeriver implements LockIdDeriver {

    // Counter ids stay well inside the long range
    static final int ID_BITS = 62;

    private final LockRepository lockRepository;
    private final AtomicLong counter;

    public SequentialLockIdDeriver(LockRepository lockRepository, long origin) {
        if (origin < 0) {
            throw new IllegalArgumentException("origin must not be negative");
        }
        this.lockRepository = lockRepository;
        this.counter = new AtomicLong(origin);
    }

    @Override
    public Future<Void> initialize() {
        return lockRepository.highestIdWithin(ID_BITS)
                .onSuccess(highest -> highest.ifPresent(id -> {
                    long resumeAt = counter.accumulateAndGet(id.value().longValueExact() + 1, Math::max);
                    log.info("Sequential ids resume at {} (highest stored id {})", resumeAt, id);
                }))
                .mapEmpty();
    }

    @Override
    public Future<LockId> nextId(String owner, AssetRef asset, BigInteger amount, Instant maturity) {
        return tryNext(1);
    }

    private Future<LockId> tryNext(int attempt) {
        LockId candidate = LockId.of(counter.getAndIncrement());
        return lockRepository.isKnown(candidate)
                .compose(known -> {
                    if (!known) {
                        return Future.succeededFuture(candidate);
                    }
                    log.warn("Sequential id {} already in use (attempt {}/{})", candidate, attempt, MAX_ATTEMPTS);
                    if (attempt >= MAX_ATTEMPTS) {
                        return Future.failedFuture(LockLedgerException.duplicateId(candidate));
                    }
                    return tryNext(attempt + 1);
                });
    }

    long peekNext() {
        return counter.get();
    }
}

package com.vestlock.application.service;

import com.vestlock.application.port.out.LockRepository;
import com.vestlock.domain.exception.LockLedgerException;
import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Derives ids as SHA-256 of (owner, asset, amount, maturity, owner nonce).
 * The per-owner nonce separates two otherwise identical deposits made in the same second.
 */
@Slf4j
public class ContentHashLockIdDeriver implements LockIdDeriver {

    private static final String ALGORITHM = "SHA-256";

    private final LockRepository lockRepository;
    private final Map<String, AtomicLong> ownerNonces = new ConcurrentHashMap<>();

    public ContentHashLockIdDeriver(LockRepository lockRepository) {
        this.lockRepository = lockRepository;
    }

    @Override
    public Future<LockId> nextId(String owner, AssetRef asset, BigInteger amount, Instant maturity) {
        return tryNext(owner, asset, amount, maturity, 1);
    }

    private Future<LockId> tryNext(String owner, AssetRef asset, BigInteger amount, Instant maturity, int attempt) {
        long nonce = ownerNonces.computeIfAbsent(owner, key -> new AtomicLong()).getAndIncrement();
        LockId candidate = derive(owner, asset, amount, maturity, nonce);

        return lockRepository.isKnown(candidate)
                .compose(known -> {
                    if (!known) {
                        log.debug("Derived lock id {} for owner {} (nonce {})", candidate, owner, nonce);
                        return Future.succeededFuture(candidate);
                    }
                    log.warn("Derived id {} already in use for owner {} (attempt {}/{})",
                            candidate, owner, attempt, MAX_ATTEMPTS);
                    if (attempt >= MAX_ATTEMPTS) {
                        return Future.failedFuture(LockLedgerException.duplicateId(candidate));
                    }
                    return tryNext(owner, asset, amount, maturity, attempt + 1);
                });
    }

    static LockId derive(String owner, AssetRef asset, BigInteger amount, Instant maturity, long nonce) {
        MessageDigest digest = newDigest();
        update(digest, owner.getBytes(StandardCharsets.UTF_8));
        update(digest, asset.key().getBytes(StandardCharsets.UTF_8));
        update(digest, amount.toByteArray());
        update(digest, ByteBuffer.allocate(Long.BYTES).putLong(maturity.getEpochSecond()).array());
        update(digest, ByteBuffer.allocate(Long.BYTES).putLong(nonce).array());
        return new LockId(new BigInteger(1, digest.digest()));
    }

    // Length-prefixed so that field boundaries cannot shift
    private static void update(MessageDigest digest, byte[] field) {
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(field.length).array());
        digest.update(field);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}

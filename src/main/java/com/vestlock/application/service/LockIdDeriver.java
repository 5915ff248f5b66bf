package com.vestlock.application.service;

import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Produces the identifier of a lock about to be created.
 * Implementations never hand out an id the repository already knows.
 */
public interface LockIdDeriver {

    int MAX_ATTEMPTS = 16;

    /**
     * Bring internal state in line with ids already in the store; called once before the first nextId
     */
    default Future<Void> initialize() {
        return Future.succeededFuture();
    }

    Future<LockId> nextId(String owner, AssetRef asset, BigInteger amount, Instant maturity);
}

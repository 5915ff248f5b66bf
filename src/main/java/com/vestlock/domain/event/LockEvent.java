package com.vestlock.domain.event;

import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.LockId;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Domain event emitted after a lock was created or withdrawn
 */
@Value
public class LockEvent {

    public enum Type { DEPOSITED, WITHDRAWN }

    Type type;
    LockId lockId;
    String owner;
    AssetRef asset;
    BigInteger amount;
    Instant timestamp;
}

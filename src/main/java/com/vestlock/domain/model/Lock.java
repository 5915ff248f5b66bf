package com.vestlock.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * Lock entity - a fixed amount of an asset committed until its maturity.
 * Everything except the state is fixed at creation.
 */
@Value
@Builder(toBuilder = true)
public class Lock {
    LockId id;
    String owner;               // Account entitled to withdraw (unless a position registry decides)
    AssetRef asset;
    BigInteger amount;          // Quantity locked, in the asset's smallest unit
    Instant creationTime;       // Second precision
    Duration duration;          // Whole seconds, never negative
    LockState state;

    public Instant getMaturity() {
        return creationTime.plus(duration);
    }

    public boolean isActive() {
        return LockState.ACTIVE.equals(state);
    }

    public boolean isMatured(Instant now) {
        return !now.isBefore(getMaturity());
    }

    public Lock withdrawn() {
        if (!isActive()) {
            throw new IllegalStateException("Lock " + id + " is already " + state);
        }
        return toBuilder().state(LockState.WITHDRAWN).build();
    }

    /**
     * Create a new ACTIVE lock, checking the creation invariants
     */
    public static Lock open(LockId id, String owner, AssetRef asset, BigInteger amount,
                            Instant creationTime, Duration duration) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative");
        }
        return Lock.builder()
                .id(id)
                .owner(owner)
                .asset(asset)
                .amount(amount)
                .creationTime(creationTime)
                .duration(duration)
                .state(LockState.ACTIVE)
                .build();
    }
}

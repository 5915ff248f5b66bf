package com.vestlock.domain.vesting;

import com.vestlock.domain.model.Lock;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Linear vesting: a lock's value grows from zero at creation to its full amount at maturity.
 * Pure and deterministic; integer arithmetic truncating toward zero.
 */
public final class LinearVestingValuator {

    private LinearVestingValuator() {
    }

    /**
     * Current value of a lock at the given instant
     * @param lock The lock record (its state is not consulted)
     * @param now Valuation instant, second precision
     * @return vested amount, between 0 and lock.amount inclusive
     */
    public static BigInteger value(Lock lock, Instant now) {
        BigInteger amount = lock.getAmount();
        long durationSeconds = lock.getDuration().getSeconds();

        // Zero duration is matured at creation; also covers now >= maturity
        if (durationSeconds == 0 || lock.isMatured(now)) {
            return amount;
        }

        long elapsed = now.getEpochSecond() - lock.getCreationTime().getEpochSecond();
        if (elapsed <= 0) {
            return BigInteger.ZERO;
        }

        return amount.multiply(BigInteger.valueOf(elapsed))
                .divide(BigInteger.valueOf(durationSeconds));
    }

    /**
     * Vested value of a position made of several units of the same lock
     */
    public static BigInteger value(Lock lock, Instant now, long units) {
        if (units < 0) {
            throw new IllegalArgumentException("units must not be negative");
        }
        return value(lock, now).multiply(BigInteger.valueOf(units));
    }
}

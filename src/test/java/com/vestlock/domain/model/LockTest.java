package com.vestlock.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Lock entity
 */
class LockTest {

    private static final Instant CREATED = Instant.ofEpochSecond(1_700_000_000L);

    @Test
    void testOpen() {
        Lock lock = createLock(Duration.ofSeconds(1000));

        assertEquals(LockId.of(1), lock.getId());
        assertEquals("alice", lock.getOwner());
        assertEquals(AssetRef.nativeAsset(), lock.getAsset());
        assertEquals(BigInteger.valueOf(1000), lock.getAmount());
        assertEquals(LockState.ACTIVE, lock.getState());
        assertTrue(lock.isActive());
        assertEquals(CREATED.plusSeconds(1000), lock.getMaturity());
    }

    @Test
    void testOpenRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () ->
                Lock.open(LockId.of(1), "alice", AssetRef.nativeAsset(), BigInteger.ZERO, CREATED, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () ->
                Lock.open(LockId.of(1), "alice", AssetRef.nativeAsset(), BigInteger.ONE, CREATED, Duration.ofSeconds(-1)));
    }

    @Test
    void testIsMatured() {
        Lock lock = createLock(Duration.ofSeconds(1000));

        assertFalse(lock.isMatured(CREATED));
        assertFalse(lock.isMatured(CREATED.plusSeconds(999)));
        assertTrue(lock.isMatured(CREATED.plusSeconds(1000)));
        assertTrue(lock.isMatured(CREATED.plusSeconds(5000)));
    }

    @Test
    void testZeroDurationIsMaturedAtCreation() {
        Lock lock = createLock(Duration.ZERO);

        assertEquals(CREATED, lock.getMaturity());
        assertTrue(lock.isMatured(CREATED));
    }

    @Test
    void testWithdrawnKeepsEverythingButState() {
        Lock lock = createLock(Duration.ofSeconds(1000));
        Lock withdrawn = lock.withdrawn();

        assertEquals(LockState.WITHDRAWN, withdrawn.getState());
        assertFalse(withdrawn.isActive());
        assertEquals(lock.getId(), withdrawn.getId());
        assertEquals(lock.getAmount(), withdrawn.getAmount());
        assertEquals(lock.getMaturity(), withdrawn.getMaturity());
        assertEquals(LockState.ACTIVE, lock.getState());

        assertThrows(IllegalStateException.class, withdrawn::withdrawn);
    }

    @Test
    void testLockState() {
        assertEquals(LockState.ACTIVE, LockState.fromValue("active"));
        assertEquals("WITHDRAWN", LockState.WITHDRAWN.getValue());
        assertThrows(IllegalArgumentException.class, () -> LockState.fromValue("PENDING"));
    }

    private Lock createLock(Duration duration) {
        return Lock.open(LockId.of(1), "alice", AssetRef.nativeAsset(), BigInteger.valueOf(1000), CREATED, duration);
    }
}

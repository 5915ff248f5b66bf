package com.vestlock.application.service;

import com.vestlock.adapter.out.persistence.InMemoryLockPersistenceAdapter;
import com.vestlock.adapter.out.registry.InMemoryPositionRegistryAdapter;
import com.vestlock.application.port.in.LockQueryUseCase.LockSnapshot;
import com.vestlock.domain.exception.LedgerErrorCode;
import com.vestlock.domain.exception.LockLedgerException;
import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.Lock;
import com.vestlock.domain.model.LockId;
import com.vestlock.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.vestlock.testsupport.Futures.await;
import static com.vestlock.testsupport.Futures.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LockQueryService
 */
class LockQueryServiceTest {

    private static final long T = 1_700_000_000L;
    private static final LockId ID = LockId.of(7);

    private MutableClock clock;
    private InMemoryLockPersistenceAdapter repository;
    private LockQueryService service;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.atEpochSecond(T);
        repository = new InMemoryLockPersistenceAdapter();
        await(repository.create(Lock.open(ID, "alice", AssetRef.token("USDC"), BigInteger.valueOf(1000),
                Instant.ofEpochSecond(T), Duration.ofSeconds(1000))));
        service = new LockQueryService(repository, null, clock);
    }

    @Test
    void getMaturity_shouldBeCreationPlusDuration() throws Exception {
        assertEquals(Instant.ofEpochSecond(T + 1000), await(service.getMaturity(ID)));
    }

    @Test
    void getMaturity_unknownLock_shouldFailNotFoundRatherThanEpoch() throws Exception {
        Throwable error = awaitFailure(service.getMaturity(LockId.of(8)));

        assertTrue(LockLedgerException.hasCode(error, LedgerErrorCode.NOT_FOUND));
    }

    @Test
    void getAsset_shouldReturnLockAsset() throws Exception {
        assertEquals(AssetRef.token("USDC"), await(service.getAsset(ID)));
    }

    @Test
    void getBalance_shouldVestLinearly() throws Exception {
        assertEquals(BigInteger.ZERO, await(service.getBalance(ID)));

        clock.advanceSeconds(250);
        assertEquals(BigInteger.valueOf(250), await(service.getBalance(ID)));

        clock.set(Instant.ofEpochSecond(T + 5000));
        assertEquals(BigInteger.valueOf(1000), await(service.getBalance(ID)));
    }

    @Test
    void getBalance_shouldIgnoreSubSecondClockPrecision() throws Exception {
        clock.set(Instant.ofEpochSecond(T + 999, 999_999_999));

        assertEquals(BigInteger.valueOf(999), await(service.getBalance(ID)));
    }

    @Test
    void getLock_shouldDescribeCurrentState() throws Exception {
        clock.advanceSeconds(500);

        LockSnapshot snapshot = await(service.getLock(ID));

        assertEquals(ID, snapshot.id());
        assertEquals("alice", snapshot.owner());
        assertEquals(1000, snapshot.durationSeconds());
        assertEquals(BigInteger.valueOf(500), snapshot.vestedValue());
        assertFalse(snapshot.matured());
        assertEquals(Instant.ofEpochSecond(T + 500), snapshot.valuedAt());
    }

    @Test
    void findByOwner_blankOwner_shouldFailValidation() throws Exception {
        assertInstanceOf(IllegalArgumentException.class, awaitFailure(service.findByOwner(" ")));
    }

    @Test
    void findByOwner_unknownOwner_shouldBeEmpty() throws Exception {
        List<LockSnapshot> snapshots = await(service.findByOwner("nobody"));

        assertTrue(snapshots.isEmpty());
    }

    @Test
    void getHoldingValue_withoutRegistry_shouldCreditOnlyRecordOwner() throws Exception {
        clock.advanceSeconds(100);

        assertEquals(BigInteger.valueOf(100), await(service.getHoldingValue(ID, "alice")));
        assertEquals(BigInteger.ZERO, await(service.getHoldingValue(ID, "bob")));
    }

    @Test
    void getHoldingValue_withRegistry_shouldFollowPositionHolder() throws Exception {
        InMemoryPositionRegistryAdapter registry = new InMemoryPositionRegistryAdapter();
        await(registry.register(ID, "alice"));
        await(registry.reassign(ID, "alice", "bob"));
        LockQueryService registryService = new LockQueryService(repository, registry, clock);
        clock.advanceSeconds(100);

        assertEquals(BigInteger.ZERO, await(registryService.getHoldingValue(ID, "alice")));
        assertEquals(BigInteger.valueOf(100), await(registryService.getHoldingValue(ID, "bob")));
    }

    @Test
    void queries_afterRemoval_shouldFailNotFound() throws Exception {
        await(repository.remove(ID));

        assertTrue(LockLedgerException.hasCode(awaitFailure(service.getAsset(ID)), LedgerErrorCode.NOT_FOUND));
        assertTrue(LockLedgerException.hasCode(awaitFailure(service.getBalance(ID)), LedgerErrorCode.NOT_FOUND));
        assertTrue(LockLedgerException.hasCode(awaitFailure(service.getLock(ID)), LedgerErrorCode.NOT_FOUND));
        assertTrue(LockLedgerException.hasCode(
                awaitFailure(service.getHoldingValue(ID, "alice")), LedgerErrorCode.NOT_FOUND));
    }
}

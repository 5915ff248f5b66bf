package com.vestlock.adapter.out.persistence;

import com.vestlock.domain.exception.LedgerErrorCode;
import com.vestlock.domain.exception.LockLedgerException;
import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.Lock;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.jdbcclient.JDBCPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.vestlock.testsupport.Futures.await;
import static com.vestlock.testsupport.Futures.awaitFailure;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for JdbcLockPersistenceAdapter against an in-memory H2 database
 */
class JdbcLockPersistenceAdapterTest {

    private static final long T = 1_700_000_000L;

    private Vertx vertx;
    private JDBCPool pool;
    private JdbcLockPersistenceAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        pool = JDBCPool.pool(vertx, new JsonObject()
                .put("url", "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .put("driver_class", "org.h2.Driver")
                .put("user", "sa")
                .put("password", "")
                .put("max_pool_size", 4));
        adapter = new JdbcLockPersistenceAdapter(pool);
        await(adapter.initializeSchema());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (pool != null) {
            await(pool.close());
        }
        if (vertx != null) {
            CountDownLatch latch = new CountDownLatch(1);
            vertx.close().onComplete(ar -> latch.countDown());
            latch.await(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void initializeSchema_shouldBeIdempotent() throws Exception {
        await(adapter.initializeSchema());
    }

    @Test
    void create_thenGet_shouldRoundTripAllFields() throws Exception {
        BigInteger maxUint256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
        LockId id = new LockId(maxUint256);
        Lock lock = Lock.open(id, "alice", AssetRef.token("USDC"), maxUint256,
                Instant.ofEpochSecond(T), Duration.ofSeconds(1000));

        await(adapter.create(lock));

        assertEquals(lock, await(adapter.get(id)));
    }

    @Test
    void create_nativeAsset_shouldRoundTrip() throws Exception {
        Lock lock = lock(1, "alice", AssetRef.nativeAsset(), 100, T);

        await(adapter.create(lock));

        assertEquals(AssetRef.nativeAsset(), await(adapter.get(LockId.of(1))).getAsset());
    }

    @Test
    void create_duplicateId_shouldFail() throws Exception {
        await(adapter.create(lock(1, "alice", AssetRef.nativeAsset(), 100, T)));

        Throwable error = awaitFailure(adapter.create(lock(1, "bob", AssetRef.nativeAsset(), 5, T)));

        assertTrue(LockLedgerException.hasCode(error, LedgerErrorCode.DUPLICATE_ID));
    }

    @Test
    void remove_shouldTombstoneAndRetireId() throws Exception {
        await(adapter.create(lock(1, "alice", AssetRef.nativeAsset(), 100, T)));

        await(adapter.remove(LockId.of(1)));

        assertTrue(LockLedgerException.hasCode(awaitFailure(adapter.get(LockId.of(1))), LedgerErrorCode.NOT_FOUND));
        assertTrue(LockLedgerException.hasCode(awaitFailure(adapter.remove(LockId.of(1))), LedgerErrorCode.NOT_FOUND));
        assertTrue(await(adapter.isKnown(LockId.of(1))));

        Throwable error = awaitFailure(adapter.create(lock(1, "alice", AssetRef.nativeAsset(), 100, T)));
        assertTrue(LockLedgerException.hasCode(error, LedgerErrorCode.DUPLICATE_ID));
    }

    @Test
    void get_unknownId_shouldFailNotFound() throws Exception {
        Throwable error = awaitFailure(adapter.get(LockId.of(42)));

        assertTrue(LockLedgerException.hasCode(error, LedgerErrorCode.NOT_FOUND));
        assertFalse(await(adapter.isKnown(LockId.of(42))));
    }

    @Test
    void findByOwner_shouldReturnActiveLocksInCreationOrder() throws Exception {
        await(adapter.create(lock(3, "alice", AssetRef.nativeAsset(), 100, T + 20)));
        await(adapter.create(lock(1, "alice", AssetRef.nativeAsset(), 100, T + 10)));
        await(adapter.create(lock(4, "alice", AssetRef.nativeAsset(), 100, T + 30)));
        await(adapter.create(lock(2, "bob", AssetRef.nativeAsset(), 100, T)));
        await(adapter.remove(LockId.of(4)));

        List<Lock> locks = await(adapter.findByOwner("alice"));

        assertEquals(List.of(LockId.of(1), LockId.of(3)), locks.stream().map(Lock::getId).toList());
    }

    @Test
    void totalLocked_shouldSumActiveAmountsPerAsset() throws Exception {
        AssetRef usdc = AssetRef.token("USDC");
        await(adapter.create(lock(1, "alice", AssetRef.nativeAsset(), 100, T)));
        await(adapter.create(lock(2, "bob", AssetRef.nativeAsset(), 50, T)));
        await(adapter.create(lock(3, "bob", usdc, 7, T)));
        await(adapter.remove(LockId.of(2)));

        assertEquals(BigInteger.valueOf(100), await(adapter.totalLocked(AssetRef.nativeAsset())));
        assertEquals(BigInteger.valueOf(7), await(adapter.totalLocked(usdc)));
        assertEquals(BigInteger.ZERO, await(adapter.totalLocked(AssetRef.token("DAI"))));
        assertEquals(Set.of(AssetRef.nativeAsset(), usdc), await(adapter.lockedAssets()));
    }

    @Test
    void highestIdWithin_shouldCountRetiredIdsAndSkipWideOnes() throws Exception {
        await(adapter.create(lock(0xff, "alice", AssetRef.nativeAsset(), 100, T)));
        await(adapter.create(lock(0x1f0, "alice", AssetRef.nativeAsset(), 100, T)));
        await(adapter.create(lock(0x2a, "bob", AssetRef.nativeAsset(), 100, T)));
        await(adapter.remove(LockId.of(0x1f0)));
        await(adapter.create(Lock.open(new LockId(BigInteger.ONE.shiftLeft(200)), "bob", AssetRef.nativeAsset(),
                BigInteger.TEN, Instant.ofEpochSecond(T), Duration.ofSeconds(1000))));

        assertEquals(Optional.of(LockId.of(0x1f0)), await(adapter.highestIdWithin(62)));
        assertEquals(Optional.of(LockId.of(0xff)), await(adapter.highestIdWithin(8)));
        assertEquals(Optional.empty(), await(adapter.highestIdWithin(5)));
    }

    @Test
    void highestIdWithin_emptyStore_shouldBeEmpty() throws Exception {
        assertEquals(Optional.empty(), await(adapter.highestIdWithin(62)));
    }

    private static Lock lock(long id, String owner, AssetRef asset, long amount, long createdAt) {
        return Lock.open(LockId.of(id), owner, asset, BigInteger.valueOf(amount),
                Instant.ofEpochSecond(createdAt), Duration.ofSeconds(1000));
    }
}

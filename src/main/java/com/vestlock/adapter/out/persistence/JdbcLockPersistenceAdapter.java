package com.vestlock.adapter.out.persistence;

import com.vestlock.application.port.out.LockRepository;
import com.vestlock.domain.exception.LockLedgerException;
import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.AssetType;
import com.vestlock.domain.model.Lock;
import com.vestlock.domain.model.LockId;
import com.vestlock.domain.model.LockState;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.Tuple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of LockRepository
 * Withdrawn locks stay as WITHDRAWN tombstones so their ids are never reused;
 * only ACTIVE rows are ever returned.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcLockPersistenceAdapter implements LockRepository {

    static final String CREATE_TABLE_SQL = "CREATE TABLE IF NOT EXISTS LOCK_RECORD (" +
            "LOCK_ID VARCHAR(66) NOT NULL PRIMARY KEY, " +
            "OWNER_ID VARCHAR(255) NOT NULL, " +
            "ASSET_TYPE VARCHAR(16) NOT NULL, " +
            "ASSET_REF VARCHAR(255), " +
            "AMOUNT DECIMAL(78, 0) NOT NULL, " +
            "CREATION_TIME BIGINT NOT NULL, " +
            "DURATION_SECONDS BIGINT NOT NULL, " +
            "STATE VARCHAR(16) NOT NULL)";

    private static final String SELECT_COLUMNS =
            "SELECT LOCK_ID, OWNER_ID, ASSET_TYPE, ASSET_REF, AMOUNT, CREATION_TIME, DURATION_SECONDS, STATE " +
            "FROM LOCK_RECORD ";

    private final SqlClient sqlClient;

    /**
     * Create the LOCK_RECORD table when missing
     */
    public Future<Void> initializeSchema() {
        return sqlClient.query(CREATE_TABLE_SQL)
                .execute()
                .onSuccess(result -> log.info("LOCK_RECORD table ready"))
                .onFailure(error -> log.error("Failed to create LOCK_RECORD table: {}", error.getMessage()))
                .mapEmpty();
    }

    @Override
    public Future<Void> create(Lock lock) {
        String sql = "INSERT INTO LOCK_RECORD " +
                "(LOCK_ID, OWNER_ID, ASSET_TYPE, ASSET_REF, AMOUNT, CREATION_TIME, DURATION_SECONDS, STATE) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        Tuple params = Tuple.tuple()
                .addString(lock.getId().toHex())
                .addString(lock.getOwner())
                .addString(lock.getAsset().type().getValue())
                .addString(lock.getAsset().reference())
                .addBigDecimal(new BigDecimal(lock.getAmount()))
                .addLong(lock.getCreationTime().getEpochSecond())
                .addLong(lock.getDuration().getSeconds())
                .addString(lock.getState().getValue());

        // Pre-check so that a retired id is reported as DUPLICATE_ID, not as a driver error
        return isKnown(lock.getId())
                .compose(known -> {
                    if (known) {
                        log.warn("Rejected duplicate lock id {}", lock.getId());
                        return Future.failedFuture(LockLedgerException.duplicateId(lock.getId()));
                    }
                    return sqlClient.preparedQuery(sql)
                            .execute(params)
                            .recover(error -> Future.failedFuture(isConstraintViolation(error)
                                    ? LockLedgerException.duplicateId(lock.getId())
                                    : error))
                            .<Void>mapEmpty();
                })
                .onSuccess(v -> log.debug("Inserted lock {}", lock.getId()))
                .onFailure(error -> log.error("Failed to insert lock {}: {}", lock.getId(), error.getMessage()));
    }

    @Override
    public Future<Lock> get(LockId id) {
        String sql = SELECT_COLUMNS + "WHERE LOCK_ID = ? AND STATE = ?";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(id.toHex(), LockState.ACTIVE.getValue()))
                .compose(result -> {
                    if (result.size() == 0) {
                        return Future.failedFuture(LockLedgerException.notFound(id));
                    }
                    return Future.succeededFuture(toLock(result.iterator().next()));
                });
    }

    @Override
    public Future<Void> remove(LockId id) {
        String sql = "UPDATE LOCK_RECORD SET STATE = ? WHERE LOCK_ID = ? AND STATE = ?";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(LockState.WITHDRAWN.getValue(), id.toHex(), LockState.ACTIVE.getValue()))
                .compose(result -> {
                    if (result.rowCount() == 0) {
                        return Future.failedFuture(LockLedgerException.notFound(id));
                    }
                    log.debug("Tombstoned lock {}", id);
                    return Future.<Void>succeededFuture();
                })
                .onFailure(error -> log.error("Failed to remove lock {}: {}", id, error.getMessage()));
    }

    @Override
    public Future<Boolean> isKnown(LockId id) {
        String sql = "SELECT COUNT(*) AS CNT FROM LOCK_RECORD WHERE LOCK_ID = ?";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(id.toHex()))
                .map(result -> result.iterator().next().getLong("CNT") > 0);
    }

    /**
     * Ids are stored as minimal lowercase hex, so a longer string is a larger id and
     * equal-length strings sort numerically. Rows are scanned from the top until one fits.
     */
    @Override
    public Future<Optional<LockId>> highestIdWithin(int maxBits) {
        String sql = "SELECT LOCK_ID FROM LOCK_RECORD WHERE LENGTH(LOCK_ID) <= ? " +
                "ORDER BY LENGTH(LOCK_ID) DESC, LOCK_ID DESC";
        int maxLength = 2 + (maxBits + 3) / 4;

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(maxLength))
                .map(result -> {
                    for (Row row : result) {
                        LockId id = LockId.parse(row.getString("LOCK_ID"));
                        if (id.value().bitLength() <= maxBits) {
                            return Optional.of(id);
                        }
                    }
                    return Optional.<LockId>empty();
                });
    }

    @Override
    public Future<List<Lock>> findByOwner(String owner) {
        String sql = SELECT_COLUMNS + "WHERE OWNER_ID = ? AND STATE = ? ORDER BY CREATION_TIME, LOCK_ID";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(owner, LockState.ACTIVE.getValue()))
                .map(result -> {
                    List<Lock> locks = new ArrayList<>();
                    result.forEach(row -> locks.add(toLock(row)));
                    log.debug("Found {} active locks for owner {}", locks.size(), owner);
                    return locks;
                });
    }

    @Override
    public Future<BigInteger> totalLocked(AssetRef asset) {
        String sql = "SELECT COALESCE(SUM(AMOUNT), 0) AS TOTAL FROM LOCK_RECORD " +
                "WHERE ASSET_TYPE = ? AND STATE = ? AND " +
                (asset.isNative() ? "ASSET_REF IS NULL" : "ASSET_REF = ?");

        Tuple params = Tuple.of(asset.type().getValue(), LockState.ACTIVE.getValue());
        if (!asset.isNative()) {
            params.addString(asset.reference());
        }

        return sqlClient.preparedQuery(sql)
                .execute(params)
                .map(result -> result.iterator().next().getBigDecimal("TOTAL").toBigIntegerExact());
    }

    @Override
    public Future<Set<AssetRef>> lockedAssets() {
        String sql = "SELECT DISTINCT ASSET_TYPE, ASSET_REF FROM LOCK_RECORD WHERE STATE = ?";

        return sqlClient.preparedQuery(sql)
                .execute(Tuple.of(LockState.ACTIVE.getValue()))
                .map(result -> {
                    Set<AssetRef> assets = new HashSet<>();
                    result.forEach(row -> assets.add(toAsset(row)));
                    return assets;
                });
    }

    private Lock toLock(Row row) {
        return Lock.builder()
                .id(LockId.parse(row.getString("LOCK_ID")))
                .owner(row.getString("OWNER_ID"))
                .asset(toAsset(row))
                .amount(row.getBigDecimal("AMOUNT").toBigIntegerExact())
                .creationTime(Instant.ofEpochSecond(row.getLong("CREATION_TIME")))
                .duration(Duration.ofSeconds(row.getLong("DURATION_SECONDS")))
                .state(LockState.fromValue(row.getString("STATE")))
                .build();
    }

    private AssetRef toAsset(Row row) {
        AssetType type = AssetType.fromValue(row.getString("ASSET_TYPE"));
        return type == AssetType.NATIVE
                ? AssetRef.nativeAsset()
                : AssetRef.token(row.getString("ASSET_REF"));
    }

    // SQLState class 23 is integrity constraint violation (H2, Oracle, PostgreSQL...)
    private static boolean isConstraintViolation(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof java.sql.SQLException) {
                String state = ((java.sql.SQLException) current).getSQLState();
                if (state != null && state.startsWith("23")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}

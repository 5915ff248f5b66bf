package com.vestlock.application.port.in;

import com.vestlock.domain.model.AssetRef;
import io.vertx.core.Future;

import java.math.BigInteger;
import java.util.List;

/**
 * Input port for checking that custody matches the sum of active locks
 */
public interface SolvencyAuditUseCase {

    /**
     * Audit a single asset
     */
    Future<SolvencyReport> audit(AssetRef asset);

    /**
     * Audit every asset currently locked
     */
    Future<List<SolvencyReport>> auditAll();

    /**
     * Start periodic audit
     */
    void startPeriodicAudit(long intervalMs);

    /**
     * Stop periodic audit
     */
    void stopPeriodicAudit();

    record SolvencyReport(AssetRef asset, BigInteger totalLocked, BigInteger custodyBalance) {

        public boolean isSolvent() {
            return totalLocked.compareTo(custodyBalance) == 0;
        }
    }
}

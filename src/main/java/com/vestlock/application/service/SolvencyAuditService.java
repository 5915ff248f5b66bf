package com.vestlock.application.service;

import com.vestlock.application.port.in.SolvencyAuditUseCase;
import com.vestlock.application.port.out.AssetTransferPort;
import com.vestlock.application.port.out.LockRepository;
import com.vestlock.domain.model.AssetRef;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Checks that, per asset, custody equals the sum of active lock amounts
 */
@Slf4j
public class SolvencyAuditService implements SolvencyAuditUseCase {

    private final Vertx vertx;
    private final LockRepository lockRepository;
    private final AssetTransferPort assetTransfer;
    private Long timerId;

    public SolvencyAuditService(Vertx vertx, LockRepository lockRepository, AssetTransferPort assetTransfer) {
        this.vertx = vertx;
        this.lockRepository = lockRepository;
        this.assetTransfer = assetTransfer;
    }

    @Override
    public Future<SolvencyReport> audit(AssetRef asset) {
        return lockRepository.totalLocked(asset)
                .compose(locked -> assetTransfer.custodyBalance(asset)
                        .map(custody -> new SolvencyReport(asset, locked, custody)))
                .onSuccess(this::logReport)
                .onFailure(error -> log.error("Solvency audit of {} failed: {}", asset, error.getMessage()));
    }

    @Override
    public Future<List<SolvencyReport>> auditAll() {
        return lockRepository.lockedAssets()
                .compose(assets -> {
                    List<AssetRef> ordered = new ArrayList<>(assets);
                    ordered.sort(Comparator.comparing(AssetRef::key));

                    // Audit assets sequentially
                    List<SolvencyReport> reports = new ArrayList<>();
                    Future<Void> future = Future.succeededFuture();
                    for (AssetRef asset : ordered) {
                        future = future.compose(v -> audit(asset)
                                .onSuccess(reports::add)
                                .mapEmpty());
                    }
                    return future.map(reports);
                });
    }

    @Override
    public void startPeriodicAudit(long intervalMs) {
        if (intervalMs <= 0) {
            log.info("Periodic solvency audit disabled");
            return;
        }
        stopPeriodicAudit();
        timerId = vertx.setPeriodic(intervalMs, id -> {
            log.debug("Periodic solvency audit triggered");
            auditAll().onFailure(error -> log.error("Periodic solvency audit failed", error));
        });
        log.info("Solvency audit scheduled every {} ms", intervalMs);
    }

    @Override
    public void stopPeriodicAudit() {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
            timerId = null;
            log.info("Solvency audit stopped");
        }
    }

    private void logReport(SolvencyReport report) {
        if (report.isSolvent()) {
            log.info("Solvency check passed for {}: {} locked, {} in custody",
                    report.asset(), report.totalLocked(), report.custodyBalance());
        } else {
            log.error("SOLVENCY BREACH for {}: {} locked but {} in custody",
                    report.asset(), report.totalLocked(), report.custodyBalance());
        }
    }
}

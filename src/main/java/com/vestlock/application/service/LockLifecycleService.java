package com.vestlock.application.service;

import com.vestlock.application.port.in.DepositUseCase;
import com.vestlock.application.port.in.WithdrawUseCase;
import com.vestlock.application.port.out.AssetTransferPort;
import com.vestlock.application.port.out.LockEventPublisher;
import com.vestlock.application.port.out.LockRepository;
import com.vestlock.application.port.out.OwnershipRegistry;
import com.vestlock.domain.event.LockEvent;
import com.vestlock.domain.exception.LockLedgerException;
import com.vestlock.domain.model.AssetRef;
import com.vestlock.domain.model.Lock;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Application service implementing deposit and withdraw
 *
 * Deposit:  validate, derive id, take custody, record lock (custody is handed back if recording fails)
 * Withdraw: load, authorize, check maturity, remove record, release custody
 *
 * Mutations are serialized per ledger instance. On withdraw the record is gone before
 * the asset transfer runs, so a call re-entering the ledger from inside the transfer
 * can no longer see the lock.
 */
@Slf4j
public class LockLifecycleService implements DepositUseCase, WithdrawUseCase {

    private final DepositValidator validator;
    private final LockRepository lockRepository;
    private final LockIdDeriver idDeriver;
    private final AssetTransferPort assetTransfer;
    private final OwnershipRegistry ownershipRegistry;
    private final LockEventPublisher eventPublisher;
    private final Clock clock;
    private final OperationSequencer sequencer = new OperationSequencer();

    /**
     * @param ownershipRegistry registry of transferable positions, or null to authorize
     *                          withdrawals against the owner stored in the lock record
     */
    public LockLifecycleService(
            DepositValidator validator,
            LockRepository lockRepository,
            LockIdDeriver idDeriver,
            AssetTransferPort assetTransfer,
            OwnershipRegistry ownershipRegistry,
            LockEventPublisher eventPublisher,
            Clock clock
    ) {
        this.validator = validator;
        this.lockRepository = lockRepository;
        this.idDeriver = idDeriver;
        this.assetTransfer = assetTransfer;
        this.ownershipRegistry = ownershipRegistry;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public Future<LockId> deposit(DepositCommand command) {
        log.info("Processing deposit from {}: {} {} for {}s",
                command.caller(), command.amount(), command.asset(), command.durationSeconds());

        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Deposit validation failed for {}: {}", command.caller(), validation.errors());
            return Future.failedFuture(new IllegalArgumentException("Validation failed: " + validation.describe()));
        }

        AssetRef asset = AssetRef.parse(command.asset());
        BigInteger amount = command.amount().toBigIntegerExact();
        Duration duration = Duration.ofSeconds(command.durationSeconds().longValueExact());

        return sequencer.submit(() -> executeDeposit(command.caller(), asset, amount, duration));
    }

    @Override
    public Future<BigInteger> withdraw(WithdrawCommand command) {
        if (command.caller() == null || command.caller().isBlank()) {
            return Future.failedFuture(new IllegalArgumentException("caller is required"));
        }
        if (command.lockId() == null) {
            return Future.failedFuture(new IllegalArgumentException("lockId is required"));
        }
        log.info("Processing withdraw of lock {} by {}", command.lockId(), command.caller());

        return sequencer.submit(() -> executeWithdraw(command.caller(), command.lockId()));
    }

    private Future<LockId> executeDeposit(String caller, AssetRef asset, BigInteger amount, Duration duration) {
        Instant now = now();
        Instant maturity = now.plus(duration);

        // Step 1: Derive id
        return idDeriver.nextId(caller, asset, amount, maturity)
                .compose(id -> {
                    log.debug("Step 1: Derived lock id {}", id);

                    // Step 2: Take custody
                    return takeCustody(id, caller, asset, amount).map(id);
                })
                .compose(id -> {
                    log.debug("Step 2: Custody taken for lock {}", id);

                    // Step 3: Record lock
                    Lock lock = Lock.open(id, caller, asset, amount, now, duration);
                    return recordLock(lock).map(lock);
                })
                .onSuccess(lock -> {
                    log.info("Lock {} opened for {}: {} {} maturing at {}",
                            lock.getId(), caller, amount, asset, lock.getMaturity());
                    publish(LockEvent.Type.DEPOSITED, lock);
                })
                .onFailure(error -> log.error("Deposit from {} failed: {}", caller, error.getMessage()))
                .map(Lock::getId);
    }

    private Future<BigInteger> executeWithdraw(String caller, LockId id) {
        return lockRepository.get(id)
                .compose(lock -> authorize(lock, caller).map(lock))
                .compose(lock -> {
                    Instant now = now();
                    if (!lock.isMatured(now)) {
                        log.warn("Withdraw of lock {} rejected: matures at {}, now {}", id, lock.getMaturity(), now);
                        return Future.failedFuture(
                                LockLedgerException.lockPeriodOngoing(id, lock.getMaturity().getEpochSecond()));
                    }

                    // Effects first: the lock is closed before any asset leaves custody
                    Lock closed = lock.withdrawn();
                    return closeRecord(closed)
                            .compose(v -> releaseCustody(closed, caller))
                            .map(closed);
                })
                .onSuccess(closed -> {
                    log.info("Lock {} withdrawn by {}: released {} {}",
                            id, caller, closed.getAmount(), closed.getAsset());
                    publish(LockEvent.Type.WITHDRAWN, closed.toBuilder().owner(caller).build());
                })
                .onFailure(error -> log.warn("Withdraw of lock {} by {} failed: {}", id, caller, error.getMessage()))
                .map(Lock::getAmount);
    }

    private Future<Void> takeCustody(LockId id, String caller, AssetRef asset, BigInteger amount) {
        return assetTransfer.transferIn(caller, asset, amount)
                .recover(error -> Future.failedFuture(LockLedgerException.transferFailed(id, error)));
    }

    /**
     * Store the lock and, in registry mode, mint its position.
     * Any failure here undoes what was done so far, custody included.
     */
    private Future<Void> recordLock(Lock lock) {
        return lockRepository.create(lock)
                .compose(v -> registerPosition(lock)
                        .recover(error -> lockRepository.remove(lock.getId())
                                .transform(ar -> Future.<Void>failedFuture(error))))
                .recover(error -> refundCustody(lock, error));
    }

    private Future<Void> refundCustody(Lock lock, Throwable cause) {
        log.warn("Recording lock {} failed, returning custody to {}: {}",
                lock.getId(), lock.getOwner(), cause.getMessage());

        return assetTransfer.transferOut(lock.getOwner(), lock.getAsset(), lock.getAmount())
                .transform(ar -> {
                    if (ar.failed()) {
                        log.error("CRITICAL: custody of {} {} for {} could not be returned after failed deposit",
                                lock.getAmount(), lock.getAsset(), lock.getOwner(), ar.cause());
                        return Future.<Void>failedFuture(LockLedgerException.custodyStranded(lock.getId(), ar.cause()));
                    }
                    return Future.<Void>failedFuture(cause);
                });
    }

    private Future<Void> authorize(Lock lock, String caller) {
        if (ownershipRegistry == null) {
            return caller.equals(lock.getOwner())
                    ? Future.<Void>succeededFuture()
                    : rejectCaller(lock.getId(), caller);
        }
        return ownershipRegistry.ownerOf(lock.getId())
                .compose(holder -> caller.equals(holder)
                        ? Future.<Void>succeededFuture()
                        : rejectCaller(lock.getId(), caller));
    }

    private Future<Void> rejectCaller(LockId id, String caller) {
        log.warn("Withdraw of lock {} rejected: {} is not the owner", id, caller);
        return Future.failedFuture(LockLedgerException.unauthorized(id, caller));
    }

    /**
     * Burn the position, then drop the record. The position is re-minted if the record
     * cannot be dropped, so that a failure leaves nothing changed.
     */
    private Future<Void> closeRecord(Lock closed) {
        return releasePosition(closed)
                .compose(v -> lockRepository.remove(closed.getId())
                        .recover(error -> registerPosition(closed)
                                .transform(ar -> Future.<Void>failedFuture(error))));
    }

    // The caller is the record owner, or the current position holder in registry mode
    private Future<Void> releaseCustody(Lock closed, String caller) {
        return assetTransfer.transferOut(caller, closed.getAsset(), closed.getAmount())
                .recover(error -> {
                    log.error("CRITICAL: lock {} is withdrawn but {} {} could not be released to {}",
                            closed.getId(), closed.getAmount(), closed.getAsset(), caller, error);
                    return Future.failedFuture(LockLedgerException.custodyStranded(closed.getId(), error));
                });
    }

    private Future<Void> registerPosition(Lock lock) {
        if (ownershipRegistry == null) {
            return Future.succeededFuture();
        }
        return ownershipRegistry.register(lock.getId(), lock.getOwner());
    }

    private Future<Void> releasePosition(Lock lock) {
        if (ownershipRegistry == null) {
            return Future.succeededFuture();
        }
        return ownershipRegistry.release(lock.getId());
    }

    private void publish(LockEvent.Type type, Lock lock) {
        eventPublisher.publish(new LockEvent(type, lock.getId(), lock.getOwner(), lock.getAsset(),
                lock.getAmount(), now()));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }
}

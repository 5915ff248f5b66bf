package com.vestlock.application.port.in;

import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;

import java.math.BigDecimal;

/**
 * Input port for locking an asset for a duration
 */
public interface DepositUseCase {

    /**
     * Take custody of the amount and open a lock for the caller
     * @param command The deposit command
     * @return Future with the id of the new lock
     */
    Future<LockId> deposit(DepositCommand command);

    /**
     * Command object for a deposit
     * Amount and duration arrive as decimals and must be whole numbers
     */
    record DepositCommand(
            String caller,
            String asset,
            BigDecimal amount,
            BigDecimal durationSeconds
    ) {}
}

package com.vestlock.application.port.in;

import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;

import java.math.BigInteger;

/**
 * Input port for withdrawing a matured lock
 */
public interface WithdrawUseCase {

    /**
     * Close the lock and release its full amount to the caller
     * @param command The withdraw command
     * @return Future with the released amount
     */
    Future<BigInteger> withdraw(WithdrawCommand command);

    record WithdrawCommand(String caller, LockId lockId) {}
}

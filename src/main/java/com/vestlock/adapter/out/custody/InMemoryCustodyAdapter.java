package com.vestlock.adapter.out.custody;

import com.vestlock.application.port.out.AssetTransferPort;
import com.vestlock.domain.model.AssetRef;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Simulated asset ledger implementing AssetTransferPort
 * Keeps a balance per (account, asset) and one custody balance per asset.
 * Transfers fail on insufficient funds instead of going negative.
 */
@Slf4j
public class InMemoryCustodyAdapter implements AssetTransferPort {

    private final Map<AccountKey, BigInteger> balances = new HashMap<>();
    private final Map<AssetRef, BigInteger> custody = new HashMap<>();

    /**
     * Credit an account from outside the ledger (faucet, fixtures)
     */
    public synchronized void credit(String account, AssetRef asset, BigInteger amount) {
        requirePositive(amount);
        balances.merge(new AccountKey(account, asset), amount, BigInteger::add);
        log.debug("Credited {} {} to {}", amount, asset, account);
    }

    /**
     * Put back custody for locks that outlived a restart of this simulated ledger.
     * Custody is raised to the given amount, never lowered.
     */
    public synchronized void restoreCustody(AssetRef asset, BigInteger lockedTotal) {
        BigInteger held = custody.getOrDefault(asset, BigInteger.ZERO);
        if (lockedTotal.compareTo(held) > 0) {
            custody.put(asset, lockedTotal);
            log.warn("Restored custody of {} to {} (was {})", asset, lockedTotal, held);
        }
    }

    public synchronized BigInteger balanceOf(String account, AssetRef asset) {
        return balances.getOrDefault(new AccountKey(account, asset), BigInteger.ZERO);
    }

    @Override
    public synchronized Future<Void> transferIn(String from, AssetRef asset, BigInteger amount) {
        requirePositive(amount);
        AccountKey key = new AccountKey(from, asset);
        BigInteger available = balances.getOrDefault(key, BigInteger.ZERO);
        if (available.compareTo(amount) < 0) {
            log.warn("Transfer in of {} {} from {} refused: balance {}", amount, asset, from, available);
            return Future.failedFuture(new IllegalStateException(
                    "Insufficient balance: " + from + " holds " + available + " " + asset));
        }
        balances.put(key, available.subtract(amount));
        custody.merge(asset, amount, BigInteger::add);
        log.debug("Transferred {} {} from {} into custody", amount, asset, from);
        return Future.succeededFuture();
    }

    @Override
    public synchronized Future<Void> transferOut(String to, AssetRef asset, BigInteger amount) {
        requirePositive(amount);
        BigInteger held = custody.getOrDefault(asset, BigInteger.ZERO);
        if (held.compareTo(amount) < 0) {
            log.error("Transfer out of {} {} to {} refused: custody holds {}", amount, asset, to, held);
            return Future.failedFuture(new IllegalStateException(
                    "Insufficient custody: " + held + " " + asset));
        }
        custody.put(asset, held.subtract(amount));
        balances.merge(new AccountKey(to, asset), amount, BigInteger::add);
        log.debug("Released {} {} from custody to {}", amount, asset, to);
        return Future.succeededFuture();
    }

    @Override
    public synchronized Future<BigInteger> custodyBalance(AssetRef asset) {
        return Future.succeededFuture(custody.getOrDefault(asset, BigInteger.ZERO));
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
    }

    private record AccountKey(String account, AssetRef asset) {
        AccountKey {
            Objects.requireNonNull(account, "account must not be null");
            Objects.requireNonNull(asset, "asset must not be null");
        }
    }
}

package com.vestlock.application.port.out;

import com.vestlock.domain.model.AssetRef;
import io.vertx.core.Future;

import java.math.BigInteger;

/**
 * Output port for moving assets in and out of the ledger's custody.
 * The ledger relies only on success or failure of each call.
 */
public interface AssetTransferPort {

    /**
     * Move the amount from the account into custody
     */
    Future<Void> transferIn(String from, AssetRef asset, BigInteger amount);

    /**
     * Release the amount from custody to the account
     */
    Future<Void> transferOut(String to, AssetRef asset, BigInteger amount);

    /**
     * Amount of the asset currently held in custody
     */
    Future<BigInteger> custodyBalance(AssetRef asset);
}

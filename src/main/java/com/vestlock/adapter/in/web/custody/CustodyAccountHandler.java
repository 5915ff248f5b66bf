package com.vestlock.adapter.in.web.custody;

import com.vestlock.adapter.in.web.ApiErrorResponse;
import com.vestlock.adapter.out.custody.InMemoryCustodyAdapter;
import com.vestlock.domain.model.AssetRef;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Account funding and balances of the simulated asset ledger
 * Only mounted while custody is simulated in memory
 */
@Slf4j
@RequiredArgsConstructor
public class CustodyAccountHandler {

    private final InMemoryCustodyAdapter custody;

    // POST /api/accounts/:account/credit  {"asset": "...", "amount": "..."}
    public void credit(RoutingContext context) {
        String account = context.pathParam("account");
        try {
            JsonObject body = context.body().asJsonObject();
            if (body == null) {
                ApiErrorResponse.send(context, 400, "Request body is required");
                return;
            }
            AssetRef asset = AssetRef.parse(body.getString("asset"));
            BigInteger amount = new BigInteger(String.valueOf(body.getValue("amount")));

            custody.credit(account, asset, amount);
            log.info("Credited {} {} to account {}", amount, asset, account);
            send(context, account, asset);
        } catch (IllegalArgumentException | DecodeException e) {
            ApiErrorResponse.send(context, 400, "Invalid credit request: " + e.getMessage());
        }
    }

    // GET /api/accounts/:account/balance?asset=...
    public void balance(RoutingContext context) {
        try {
            AssetRef asset = AssetRef.parse(context.queryParams().get("asset"));
            send(context, context.pathParam("account"), asset);
        } catch (IllegalArgumentException e) {
            ApiErrorResponse.send(context, 400, e.getMessage());
        }
    }

    private void send(RoutingContext context, String account, AssetRef asset) {
        context.response()
                .setStatusCode(200)
                .putHeader("Content-Type", "application/json")
                .end(new JsonObject()
                        .put("account", account)
                        .put("asset", asset.key())
                        .put("balance", custody.balanceOf(account, asset).toString())
                        .encode());
    }
}

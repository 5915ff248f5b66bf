package com.vestlock.adapter.in.web.lockquery;

import com.vestlock.adapter.in.web.ApiErrorResponse;
import com.vestlock.application.port.in.LockQueryUseCase;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * HTTP handlers for the valuation and maturity queries
 */
@Slf4j
@RequiredArgsConstructor
public class LockQueryHandler {

    private final LockQueryUseCase lockQueryUseCase;

    // GET /api/locks/:id
    public void getLock(RoutingContext context) {
        withLockId(context, id -> lockQueryUseCase.getLock(id)
                .map(snapshot -> JsonObject.mapFrom(LockQueryResponse.from(snapshot))));
    }

    // GET /api/locks/:id/asset
    public void getAsset(RoutingContext context) {
        withLockId(context, id -> lockQueryUseCase.getAsset(id)
                .map(asset -> new JsonObject()
                        .put("lockId", id.toHex())
                        .put("asset", asset.key())
                        .put("assetType", asset.type().getValue())));
    }

    // GET /api/locks/:id/balance[?holder=account]
    public void getBalance(RoutingContext context) {
        String holder = context.queryParams().get("holder");
        withLockId(context, id -> {
            if (holder != null) {
                return lockQueryUseCase.getHoldingValue(id, holder)
                        .map(value -> new JsonObject()
                                .put("lockId", id.toHex())
                                .put("holder", holder)
                                .put("balance", value.toString()));
            }
            return lockQueryUseCase.getBalance(id)
                    .map(value -> new JsonObject()
                            .put("lockId", id.toHex())
                            .put("balance", value.toString()));
        });
    }

    // GET /api/locks/:id/maturity
    public void getMaturity(RoutingContext context) {
        withLockId(context, id -> lockQueryUseCase.getMaturity(id)
                .map(maturity -> new JsonObject()
                        .put("lockId", id.toHex())
                        .put("maturity", maturity.getEpochSecond())));
    }

    // GET /api/owners/:owner/locks
    public void findByOwner(RoutingContext context) {
        String owner = context.pathParam("owner");
        lockQueryUseCase.findByOwner(owner)
                .onSuccess(snapshots -> {
                    JsonArray locks = new JsonArray();
                    snapshots.forEach(snapshot -> locks.add(JsonObject.mapFrom(LockQueryResponse.from(snapshot))));
                    sendJson(context, new JsonObject()
                            .put("owner", owner)
                            .put("count", locks.size())
                            .put("locks", locks));
                })
                .onFailure(error -> ApiErrorResponse.send(context, error));
    }

    private void withLockId(RoutingContext context, Function<LockId, Future<JsonObject>> query) {
        LockId id;
        try {
            id = LockId.parse(context.pathParam("id"));
        } catch (IllegalArgumentException e) {
            ApiErrorResponse.send(context, 400, e.getMessage());
            return;
        }

        query.apply(id)
                .onSuccess(body -> sendJson(context, body))
                .onFailure(error -> {
                    log.debug("Query on lock {} failed: {}", id, error.getMessage());
                    ApiErrorResponse.send(context, error);
                });
    }

    private void sendJson(RoutingContext context, JsonObject body) {
        context.response()
                .setStatusCode(200)
                .putHeader("Content-Type", "application/json")
                .end(body.encode());
    }
}

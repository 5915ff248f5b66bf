package com.vestlock.adapter.in.web.withdraw;

import com.vestlock.adapter.in.web.ApiErrorResponse;
import com.vestlock.application.port.in.WithdrawUseCase;
import com.vestlock.application.port.in.WithdrawUseCase.WithdrawCommand;
import com.vestlock.domain.model.LockId;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for withdrawals
 * Handles POST /api/locks/:id/withdraw
 */
@Slf4j
@RequiredArgsConstructor
public class WithdrawHandler implements Handler<RoutingContext> {

    private final WithdrawUseCase withdrawUseCase;

    @Override
    public void handle(RoutingContext context) {
        LockId lockId;
        WithdrawRequest request;
        try {
            lockId = LockId.parse(context.pathParam("id"));
            JsonObject requestBody = context.body().asJsonObject();
            if (requestBody == null) {
                ApiErrorResponse.send(context, 400, "Request body is required");
                return;
            }
            request = requestBody.mapTo(WithdrawRequest.class);
        } catch (Exception e) {
            log.warn("Error parsing withdraw request: {}", e.getMessage());
            ApiErrorResponse.send(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        withdrawUseCase.withdraw(new WithdrawCommand(request.caller(), lockId))
                .onSuccess(amount -> context.response()
                        .setStatusCode(200)
                        .putHeader("Content-Type", "application/json")
                        .end(JsonObject.mapFrom(WithdrawResponse.success(lockId.toHex(), amount.toString())).encode()))
                .onFailure(error -> ApiErrorResponse.send(context, error));
    }
}

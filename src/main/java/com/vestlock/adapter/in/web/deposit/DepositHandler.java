package com.vestlock.adapter.in.web.deposit;

import com.vestlock.adapter.in.web.ApiErrorResponse;
import com.vestlock.application.port.in.DepositUseCase;
import com.vestlock.application.port.in.DepositUseCase.DepositCommand;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for deposits
 * Handles POST /api/locks
 */
@Slf4j
@RequiredArgsConstructor
public class DepositHandler implements Handler<RoutingContext> {

    private final DepositUseCase depositUseCase;

    @Override
    public void handle(RoutingContext context) {
        DepositRequest request;
        try {
            JsonObject requestBody = context.body().asJsonObject();
            if (requestBody == null) {
                ApiErrorResponse.send(context, 400, "Request body is required");
                return;
            }
            request = requestBody.mapTo(DepositRequest.class);
        } catch (Exception e) {
            log.warn("Error parsing deposit request: {}", e.getMessage());
            ApiErrorResponse.send(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        log.info("Received deposit request from {}", request.owner());

        DepositCommand command = new DepositCommand(
                request.owner(),
                request.asset(),
                request.amount(),
                request.durationSeconds()
        );

        depositUseCase.deposit(command)
                .onSuccess(lockId -> {
                    DepositResponse response = DepositResponse.success("Lock created", lockId.toHex());
                    context.response()
                            .setStatusCode(201)
                            .putHeader("Content-Type", "application/json")
                            .putHeader("Location", "/api/locks/" + lockId.toHex())
                            .end(JsonObject.mapFrom(response).encode());
                })
                .onFailure(error -> {
                    log.warn("Deposit from {} failed: {}", request.owner(), error.getMessage());
                    ApiErrorResponse.send(context, error);
                });
    }
}

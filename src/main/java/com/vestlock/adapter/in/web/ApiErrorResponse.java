package com.vestlock.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vestlock.domain.exception.LedgerErrorCode;
import com.vestlock.domain.exception.LockLedgerException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;

/**
 * Error body shared by all endpoints, plus the mapping of failures to HTTP status codes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        String status,
        String code,
        String message
) {

    public static ApiErrorResponse of(Throwable error) {
        String code = error instanceof LockLedgerException
                ? ((LockLedgerException) error).getCode().name()
                : null;
        return new ApiErrorResponse("error", code, error.getMessage());
    }

    public static int statusCode(Throwable error) {
        if (error instanceof IllegalArgumentException) {
            return 400;
        }
        if (error instanceof LockLedgerException) {
            return statusCode(((LockLedgerException) error).getCode());
        }
        return 500;
    }

    static int statusCode(LedgerErrorCode code) {
        switch (code) {
            case NOT_FOUND:
                return 404;
            case UNAUTHORIZED:
                return 403;
            case LOCK_PERIOD_ONGOING:
            case DUPLICATE_ID:
                return 409;
            case TRANSFER_FAILED:
                return 502;
            default:
                return 500;
        }
    }

    public static void send(RoutingContext context, Throwable error) {
        send(context, statusCode(error), of(error));
    }

    public static void send(RoutingContext context, int statusCode, String message) {
        send(context, statusCode, new ApiErrorResponse("error", null, message));
    }

    private static void send(RoutingContext context, int statusCode, ApiErrorResponse response) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(response).encode());
    }
}

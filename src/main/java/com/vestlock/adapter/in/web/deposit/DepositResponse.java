package com.vestlock.adapter.in.web.deposit;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * DTO for deposit response
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DepositResponse(
        String status,
        String message,
        String lockId
) {
    public static DepositResponse success(String message, String lockId) {
        return new DepositResponse("success", message, lockId);
    }
}

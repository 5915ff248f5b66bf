package com.vestlock.adapter.in.web.withdraw;

/**
 * DTO for withdraw response; amount as a decimal string
 */
public record WithdrawResponse(
        String status,
        String lockId,
        String amount
) {
    public static WithdrawResponse success(String lockId, String amount) {
        return new WithdrawResponse("success", lockId, amount);
    }
}

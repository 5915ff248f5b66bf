package com.vestlock.adapter.in.web.deposit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * DTO for an incoming deposit
 * amount may be sent as a JSON number or a decimal string; fractions are rejected by validation
 */
public record DepositRequest(
        String owner,
        String asset,
        BigDecimal amount,
        BigDecimal durationSeconds
) {
    @JsonCreator
    public DepositRequest(
            @JsonProperty("owner") String owner,
            @JsonProperty("asset") String asset,
            @JsonProperty("amount") BigDecimal amount,
            @JsonProperty("durationSeconds") BigDecimal durationSeconds
    ) {
        this.owner = owner;
        this.asset = asset;
        this.amount = amount;
        this.durationSeconds = durationSeconds;
    }
}

package com.vestlock.adapter.in.web.lockquery;

import com.vestlock.application.port.in.LockQueryUseCase.LockSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lock detail DTO
 * Amounts are decimal strings, instants are epoch seconds
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LockQueryResponse {
    private String lockId;
    private String owner;
    private String asset;
    private String amount;
    private Long creationTime;
    private Long durationSeconds;
    private Long maturity;

    // Valuation at valuedAt
    private String balance;
    private Boolean matured;
    private Long valuedAt;

    public static LockQueryResponse from(LockSnapshot snapshot) {
        return LockQueryResponse.builder()
                .lockId(snapshot.id().toHex())
                .owner(snapshot.owner())
                .asset(snapshot.asset().key())
                .amount(snapshot.amount().toString())
                .creationTime(snapshot.creationTime().getEpochSecond())
                .durationSeconds(snapshot.durationSeconds())
                .maturity(snapshot.maturity().getEpochSecond())
                .balance(snapshot.vestedValue().toString())
                .matured(snapshot.matured())
                .valuedAt(snapshot.valuedAt().getEpochSecond())
                .build();
    }
}

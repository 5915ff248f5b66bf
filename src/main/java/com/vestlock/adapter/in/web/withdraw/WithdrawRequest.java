package com.vestlock.adapter.in.web.withdraw;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a withdraw request; the lock id comes from the path
 */
public record WithdrawRequest(String caller) {

    @JsonCreator
    public WithdrawRequest(@JsonProperty("caller") String caller) {
        this.caller = caller;
    }
}

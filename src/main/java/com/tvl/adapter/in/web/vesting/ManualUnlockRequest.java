package com.tvl.adapter.in.web.vesting;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ManualUnlockRequest(String amount) {
    @JsonCreator
    public ManualUnlockRequest(@JsonProperty("amount") String amount) {
        this.amount = amount;
    }
}

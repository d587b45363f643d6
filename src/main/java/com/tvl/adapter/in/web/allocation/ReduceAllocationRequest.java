package com.tvl.adapter.in.web.allocation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ReduceAllocationRequest(String amount) {
    @JsonCreator
    public ReduceAllocationRequest(@JsonProperty("amount") String amount) {
        this.amount = amount;
    }
}

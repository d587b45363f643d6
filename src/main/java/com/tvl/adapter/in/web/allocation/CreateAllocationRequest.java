package com.tvl.adapter.in.web.allocation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a new allocation. The amount is a decimal string in the smallest token unit.
 */
public record CreateAllocationRequest(
        String beneficiary,
        String amount
) {
    @JsonCreator
    public CreateAllocationRequest(
            @JsonProperty("beneficiary") String beneficiary,
            @JsonProperty("amount") String amount
    ) {
        this.beneficiary = beneficiary;
        this.amount = amount;
    }
}

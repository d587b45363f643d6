package com.tvl.adapter.in.web.allocation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * DTO for an airdrop: beneficiaries and amounts pair up by position
 */
public record AirdropRequest(
        List<String> beneficiaries,
        List<String> amounts
) {
    @JsonCreator
    public AirdropRequest(
            @JsonProperty("beneficiaries") List<String> beneficiaries,
            @JsonProperty("amounts") List<String> amounts
    ) {
        this.beneficiaries = beneficiaries;
        this.amounts = amounts;
    }
}

package com.tvl.adapter.in.web.vesting;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * DTO for a new vesting schedule.
 * Times are unix seconds; allocationId is optional and 0 means unlinked.
 */
public record CreateVestingScheduleRequest(
        String beneficiary,
        String totalAmount,
        Long startTime,
        Long cliffDuration,
        Long duration,
        Long allocationId
) {
    @JsonCreator
    public CreateVestingScheduleRequest(
            @JsonProperty("beneficiary") String beneficiary,
            @JsonProperty("totalAmount") String totalAmount,
            @JsonProperty("startTime") Long startTime,
            @JsonProperty("cliffDuration") Long cliffDuration,
            @JsonProperty("duration") Long duration,
            @JsonProperty("allocationId") Long allocationId
    ) {
        this.beneficiary = beneficiary;
        this.totalAmount = totalAmount;
        this.startTime = startTime;
        this.cliffDuration = cliffDuration;
        this.duration = duration;
        this.allocationId = allocationId;
    }
}

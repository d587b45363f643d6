package com.tvl.adapter.in.web.vesting;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchForceRevokeRequest(List<Long> scheduleIds) {
    @JsonCreator
    public BatchForceRevokeRequest(@JsonProperty("scheduleIds") List<Long> scheduleIds) {
        this.scheduleIds = scheduleIds;
    }
}

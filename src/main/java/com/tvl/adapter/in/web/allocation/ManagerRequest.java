package com.tvl.adapter.in.web.allocation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ManagerRequest(String manager) {
    @JsonCreator
    public ManagerRequest(@JsonProperty("manager") String manager) {
        this.manager = manager;
    }
}

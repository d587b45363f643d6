package com.tvl.adapter.in.web.admin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record RoleRequest(String role, String account) {
    @JsonCreator
    public RoleRequest(
            @JsonProperty("role") String role,
            @JsonProperty("account") String account
    ) {
        this.role = role;
        this.account = account;
    }
}

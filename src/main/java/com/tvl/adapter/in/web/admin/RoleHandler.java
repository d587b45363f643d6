package com.tvl.adapter.in.web.admin;

import com.tvl.adapter.in.web.dto.ApiResponder;
import com.tvl.adapter.in.web.dto.RequestParsing;
import com.tvl.application.port.in.VestingQueryUseCase;
import com.tvl.application.port.in.VestingUseCase;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.Role;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Role administration on the vesting engine
 * POST /api/vesting/roles, DELETE /api/vesting/roles/:role/:account, GET /api/vesting/roles/:role/:account
 */
@Slf4j
@RequiredArgsConstructor
public class RoleHandler {

    private final VestingUseCase vestingUseCase;
    private final VestingQueryUseCase vestingQueryUseCase;

    public void grant(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();
        if (requestBody == null) {
            ApiResponder.sendError(context, 400, "Request body is required");
            return;
        }

        try {
            RoleRequest request = requestBody.mapTo(RoleRequest.class);
            Address caller = RequestParsing.caller(context);
            Role role = Role.fromValue(request.role());
            Address account = RequestParsing.address(request.account(), "account");
            vestingUseCase.grantRole(caller, role, account)
                    .onSuccess(v -> ApiResponder.success(context, 200, view(role, account, true)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponder.sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }

    public void revoke(RoutingContext context) {
        try {
            Address caller = RequestParsing.caller(context);
            Role role = Role.fromValue(context.pathParam("role"));
            Address account = RequestParsing.address(context.pathParam("account"), "account");
            vestingUseCase.revokeRole(caller, role, account)
                    .onSuccess(v -> ApiResponder.success(context, 200, view(role, account, false)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException | IllegalArgumentException e) {
            ApiResponder.failure(context, e);
        }
    }

    public void check(RoutingContext context) {
        try {
            Role role = Role.fromValue(context.pathParam("role"));
            Address account = RequestParsing.address(context.pathParam("account"), "account");
            vestingQueryUseCase.hasRole(role, account)
                    .onSuccess(granted -> ApiResponder.success(context, 200, view(role, account, granted)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException | IllegalArgumentException e) {
            ApiResponder.failure(context, e);
        }
    }

    private static JsonObject view(Role role, Address account, boolean granted) {
        return new JsonObject()
                .put("role", role.getValue())
                .put("account", account.value())
                .put("granted", granted);
    }
}

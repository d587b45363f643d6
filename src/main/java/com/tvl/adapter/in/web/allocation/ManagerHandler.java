package com.tvl.adapter.in.web.allocation;

import com.tvl.adapter.in.web.dto.ApiResponder;
import com.tvl.adapter.in.web.dto.LedgerJson;
import com.tvl.adapter.in.web.dto.RequestParsing;
import com.tvl.application.port.in.AllocationQueryUseCase;
import com.tvl.application.port.in.AllocationUseCase;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handlers for the manager registry
 * GET /api/managers, POST /api/managers, DELETE /api/managers/:address
 */
@Slf4j
@RequiredArgsConstructor
public class ManagerHandler {

    private final AllocationUseCase allocationUseCase;
    private final AllocationQueryUseCase allocationQueryUseCase;

    public void list(RoutingContext context) {
        allocationQueryUseCase.getAllManagers()
                .onSuccess(managers -> ApiResponder.success(context, 200,
                        new JsonObject().put("managers", LedgerJson.addresses(managers))))
                .onFailure(error -> ApiResponder.failure(context, error));
    }

    public void add(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();
        if (requestBody == null) {
            ApiResponder.sendError(context, 400, "Request body is required");
            return;
        }

        try {
            ManagerRequest request = requestBody.mapTo(ManagerRequest.class);
            Address caller = RequestParsing.caller(context);
            Address manager = RequestParsing.address(request.manager(), "manager");
            allocationUseCase.addManager(caller, manager)
                    .onSuccess(v -> ApiResponder.success(context, 200, new JsonObject().put("manager", manager.value())))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponder.sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }

    public void remove(RoutingContext context) {
        try {
            Address caller = RequestParsing.caller(context);
            Address manager = RequestParsing.address(context.pathParam("address"), "address");
            allocationUseCase.removeManager(caller, manager)
                    .onSuccess(v -> ApiResponder.success(context, 200, new JsonObject().put("removed", manager.value())))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        }
    }
}

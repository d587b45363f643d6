package com.tvl.adapter.in.web.allocation;

import com.tvl.adapter.in.web.dto.ApiResponder;
import com.tvl.adapter.in.web.dto.LedgerJson;
import com.tvl.adapter.in.web.dto.RequestParsing;
import com.tvl.application.port.in.AllocationQueryUseCase;
import com.tvl.application.port.in.AllocationUseCase;
import com.tvl.application.port.in.AllocationUseCase.CreateAllocationCommand;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.AllocationId;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * HTTP handlers for allocations
 * POST /api/allocations, GET /api/allocations/:id, POST /api/allocations/:id/revoke,
 * POST /api/allocations/:id/reduce, GET /api/beneficiaries/:address/allocations
 */
@Slf4j
@RequiredArgsConstructor
public class AllocationHandler {

    private final AllocationUseCase allocationUseCase;
    private final AllocationQueryUseCase allocationQueryUseCase;

    public void create(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();
        if (requestBody == null) {
            ApiResponder.sendError(context, 400, "Request body is required");
            return;
        }

        try {
            CreateAllocationRequest request = requestBody.mapTo(CreateAllocationRequest.class);
            CreateAllocationCommand command = new CreateAllocationCommand(
                    RequestParsing.caller(context),
                    RequestParsing.address(request.beneficiary(), "beneficiary"),
                    RequestParsing.amount(request.amount(), "amount")
            );
            log.info("Received allocation request for {}: {}", command.beneficiary(), command.amount());

            allocationUseCase.createAllocation(command)
                    .onSuccess(id -> ApiResponder.success(context, 201,
                            new JsonObject().put("allocationId", id.value())))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponder.sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }

    public void get(RoutingContext context) {
        try {
            AllocationId id = RequestParsing.allocationId(context);
            allocationQueryUseCase.getAllocation(id)
                    .onSuccess(allocation -> ApiResponder.success(context, 200, LedgerJson.allocation(allocation)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        }
    }

    public void revoke(RoutingContext context) {
        try {
            Address caller = RequestParsing.caller(context);
            AllocationId id = RequestParsing.allocationId(context);
            allocationUseCase.revokeAllocation(caller, id)
                    .onSuccess(revoked -> ApiResponder.success(context, 200,
                            new JsonObject().put("allocationId", id.value()).put("revoked", revoked)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        }
    }

    public void reduce(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();
        if (requestBody == null) {
            ApiResponder.sendError(context, 400, "Request body is required");
            return;
        }

        try {
            ReduceAllocationRequest request = requestBody.mapTo(ReduceAllocationRequest.class);
            Address caller = RequestParsing.caller(context);
            AllocationId id = RequestParsing.allocationId(context);
            BigInteger amount = RequestParsing.amount(request.amount(), "amount");
            allocationUseCase.reduceAllocation(caller, id, amount)
                    .onSuccess(reduced -> ApiResponder.success(context, 200,
                            new JsonObject().put("allocationId", id.value()).put("reduced", reduced)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponder.sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }

    public void listForBeneficiary(RoutingContext context) {
        try {
            Address beneficiary = RequestParsing.address(context.pathParam("address"), "address");
            allocationQueryUseCase.getAllocationsForBeneficiary(beneficiary)
                    .onSuccess(ids -> {
                        JsonArray array = new JsonArray();
                        ids.forEach(id -> array.add(id.value()));
                        ApiResponder.success(context, 200, new JsonObject()
                                .put("beneficiary", beneficiary.value())
                                .put("allocationIds", array));
                    })
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        }
    }
}

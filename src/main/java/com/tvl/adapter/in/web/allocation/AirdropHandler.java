package com.tvl.adapter.in.web.allocation;

import com.tvl.adapter.in.web.dto.ApiResponder;
import com.tvl.adapter.in.web.dto.RequestParsing;
import com.tvl.application.port.in.AllocationUseCase;
import com.tvl.application.port.in.AllocationUseCase.AirdropCommand;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP handler for airdrops
 * Handles POST /api/airdrops
 */
@Slf4j
@RequiredArgsConstructor
public class AirdropHandler implements Handler<RoutingContext> {

    private final AllocationUseCase allocationUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();
        if (requestBody == null) {
            ApiResponder.sendError(context, 400, "Request body is required");
            return;
        }

        try {
            AirdropRequest request = requestBody.mapTo(AirdropRequest.class);

            List<Address> beneficiaries = new ArrayList<>();
            if (request.beneficiaries() != null) {
                for (String beneficiary : request.beneficiaries()) {
                    beneficiaries.add(RequestParsing.address(beneficiary, "beneficiaries"));
                }
            }
            List<BigInteger> amounts = new ArrayList<>();
            if (request.amounts() != null) {
                for (String amount : request.amounts()) {
                    amounts.add(RequestParsing.amount(amount, "amounts"));
                }
            }

            AirdropCommand command = new AirdropCommand(RequestParsing.caller(context), beneficiaries, amounts);
            log.info("Received airdrop request for {} beneficiaries", beneficiaries.size());

            allocationUseCase.executeAirdrop(command)
                    .onSuccess(airdropId -> ApiResponder.success(context, 201, new JsonObject()
                            .put("airdropId", airdropId)
                            .put("beneficiaries", beneficiaries.size())))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponder.sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }
}

package com.tvl.adapter.in.web.vesting;

import com.tvl.adapter.in.web.dto.ApiResponder;
import com.tvl.adapter.in.web.dto.LedgerJson;
import com.tvl.adapter.in.web.dto.RequestParsing;
import com.tvl.application.port.in.VestingQueryUseCase;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.ScheduleId;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * HTTP handlers for vesting reads
 */
@RequiredArgsConstructor
public class VestingQueryHandler {

    private final VestingQueryUseCase vestingQueryUseCase;

    public void get(RoutingContext context) {
        try {
            ScheduleId id = RequestParsing.scheduleId(context);
            vestingQueryUseCase.getVestingSchedule(id)
                    .onSuccess(schedule -> ApiResponder.success(context, 200, LedgerJson.schedule(schedule)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        }
    }

    public void info(RoutingContext context) {
        try {
            ScheduleId id = RequestParsing.scheduleId(context);
            vestingQueryUseCase.getVestingInfo(id)
                    .onSuccess(info -> ApiResponder.success(context, 200, LedgerJson.info(info)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        }
    }

    public void listForBeneficiary(RoutingContext context) {
        try {
            Address beneficiary = RequestParsing.address(context.pathParam("address"), "address");
            vestingQueryUseCase.getSchedulesForBeneficiary(beneficiary)
                    .onSuccess(ids -> {
                        JsonArray array = new JsonArray();
                        ids.forEach(id -> array.add(id.value()));
                        ApiResponder.success(context, 200, new JsonObject()
                                .put("beneficiary", beneficiary.value())
                                .put("scheduleIds", array));
                    })
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        }
    }

    public void totals(RoutingContext context) {
        vestingQueryUseCase.getTotals()
                .onSuccess(totals -> ApiResponder.success(context, 200, LedgerJson.totals(totals)))
                .onFailure(error -> ApiResponder.failure(context, error));
    }
}

package com.tvl.adapter.in.web.vesting;

import com.tvl.adapter.in.web.dto.ApiResponder;
import com.tvl.adapter.in.web.dto.RequestParsing;
import com.tvl.application.port.in.VestingUseCase;
import com.tvl.application.port.in.VestingUseCase.CreateVestingScheduleCommand;
import com.tvl.domain.exception.LedgerErrorCode;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.AllocationId;
import com.tvl.domain.model.ScheduleId;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP handlers for vesting schedule mutations
 */
@Slf4j
@RequiredArgsConstructor
public class VestingScheduleHandler {

    private final VestingUseCase vestingUseCase;

    /**
     * POST /api/schedules
     */
    public void create(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();
        if (requestBody == null) {
            ApiResponder.sendError(context, 400, "Request body is required");
            return;
        }

        try {
            CreateVestingScheduleRequest request = requestBody.mapTo(CreateVestingScheduleRequest.class);
            CreateVestingScheduleCommand command = new CreateVestingScheduleCommand(
                    RequestParsing.caller(context),
                    RequestParsing.address(request.beneficiary(), "beneficiary"),
                    RequestParsing.amount(request.totalAmount(), "totalAmount"),
                    required(request.startTime(), "startTime", LedgerErrorCode.INVALID_START_TIME),
                    required(request.cliffDuration(), "cliffDuration", LedgerErrorCode.INVALID_DURATION),
                    required(request.duration(), "duration", LedgerErrorCode.INVALID_DURATION),
                    request.allocationId() == null ? AllocationId.NONE : AllocationId.of(request.allocationId())
            );
            log.info("Received vesting schedule request for {}: {} over {}s",
                    command.beneficiary(), command.totalAmount(), command.duration());

            vestingUseCase.createVestingSchedule(command)
                    .onSuccess(id -> ApiResponder.success(context, 201,
                            new JsonObject().put("scheduleId", id.value())))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponder.sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }

    /**
     * POST /api/schedules/:id/claim
     */
    public void claim(RoutingContext context) {
        try {
            Address caller = RequestParsing.caller(context);
            ScheduleId id = RequestParsing.scheduleId(context);
            vestingUseCase.claimVestedTokens(caller, id)
                    .onSuccess(released -> ApiResponder.success(context, 200, new JsonObject()
                            .put("scheduleId", id.value())
                            .put("released", released.toString())))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        }
    }

    /**
     * POST /api/schedules/:id/unlock
     */
    public void unlock(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();
        if (requestBody == null) {
            ApiResponder.sendError(context, 400, "Request body is required");
            return;
        }

        try {
            ManualUnlockRequest request = requestBody.mapTo(ManualUnlockRequest.class);
            Address caller = RequestParsing.caller(context);
            ScheduleId id = RequestParsing.scheduleId(context);
            BigInteger amount = RequestParsing.amount(request.amount(), "amount");
            vestingUseCase.manualUnlock(caller, id, amount)
                    .onSuccess(unlocked -> ApiResponder.success(context, 200, new JsonObject()
                            .put("scheduleId", id.value())
                            .put("unlocked", amount.toString())))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponder.sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }

    /**
     * POST /api/schedules/:id/revoke
     */
    public void revoke(RoutingContext context) {
        revoke(context, false);
    }

    /**
     * POST /api/schedules/:id/force-revoke
     */
    public void forceRevoke(RoutingContext context) {
        revoke(context, true);
    }

    private void revoke(RoutingContext context, boolean forced) {
        try {
            Address caller = RequestParsing.caller(context);
            ScheduleId id = RequestParsing.scheduleId(context);
            (forced ? vestingUseCase.forceRevokeSchedule(caller, id) : vestingUseCase.revokeSchedule(caller, id))
                    .onSuccess(unvested -> ApiResponder.success(context, 200, new JsonObject()
                            .put("scheduleId", id.value())
                            .put("unvested", unvested.toString())
                            .put("forced", forced)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        }
    }

    /**
     * POST /api/schedules/batch-force-revoke
     */
    public void batchForceRevoke(RoutingContext context) {
        JsonObject requestBody = context.body().asJsonObject();
        if (requestBody == null) {
            ApiResponder.sendError(context, 400, "Request body is required");
            return;
        }

        try {
            BatchForceRevokeRequest request = requestBody.mapTo(BatchForceRevokeRequest.class);
            Address caller = RequestParsing.caller(context);
            List<ScheduleId> ids = new ArrayList<>();
            if (request.scheduleIds() != null) {
                for (Long id : request.scheduleIds()) {
                    ids.add(id == null || id < 0 ? ScheduleId.NONE : ScheduleId.of(id));
                }
            }
            vestingUseCase.batchForceRevokeSchedules(caller, ids)
                    .onSuccess(count -> ApiResponder.success(context, 200, new JsonObject()
                            .put("requested", ids.size())
                            .put("revoked", count)))
                    .onFailure(error -> ApiResponder.failure(context, error));
        } catch (LedgerException e) {
            ApiResponder.failure(context, e);
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponder.sendError(context, 400, "Invalid request format: " + e.getMessage());
        }
    }

    private static long required(Long value, String field, LedgerErrorCode onMissing) {
        if (value == null) {
            throw new LedgerException(onMissing, field + " is required");
        }
        return value;
    }
}

package com.tvl.adapter.in.web.dto;

import com.tvl.domain.model.Address;
import com.tvl.domain.model.Allocation;
import com.tvl.domain.model.VestingInfo;
import com.tvl.domain.model.VestingSchedule;
import com.tvl.domain.model.VestingTotals;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * JSON views of ledger records. Amounts are rendered as decimal strings.
 */
public final class LedgerJson {

    private LedgerJson() {
    }

    public static JsonObject allocation(Allocation allocation) {
        return new JsonObject()
                .put("allocationId", allocation.getId().value())
                .put("beneficiary", allocation.getBeneficiary().value())
                .put("amount", allocation.getAmount().toString())
                .put("consumed", allocation.isConsumed())
                .put("revoked", allocation.isRevoked())
                .put("createdAt", allocation.getCreatedAt());
    }

    public static JsonObject schedule(VestingSchedule schedule) {
        return new JsonObject()
                .put("scheduleId", schedule.getId().value())
                .put("beneficiary", schedule.getBeneficiary().value())
                .put("totalAmount", schedule.getTotalAmount().toString())
                .put("releasedAmount", schedule.getReleasedAmount().toString())
                .put("startTime", schedule.getStartTime())
                .put("cliffDuration", schedule.getCliffDuration())
                .put("duration", schedule.getDuration())
                .put("createdAt", schedule.getCreatedAt())
                .put("allocationId", schedule.getAllocationId().value())
                .put("status", schedule.getStatus().getValue())
                .put("revoked", schedule.isRevoked());
    }

    public static JsonObject info(VestingInfo info) {
        return new JsonObject()
                .put("scheduleId", info.getScheduleId().value())
                .put("beneficiary", info.getBeneficiary().value())
                .put("totalAmount", info.getTotalAmount().toString())
                .put("releasedAmount", info.getReleasedAmount().toString())
                .put("releasableAmount", info.getReleasableAmount().toString())
                .put("phase", info.getPhase().name())
                .put("asOf", info.getAsOf());
    }

    public static JsonObject totals(VestingTotals totals) {
        return new JsonObject()
                .put("totalVested", totals.getTotalVested().toString())
                .put("totalClaimed", totals.getTotalClaimed().toString());
    }

    public static JsonArray addresses(List<Address> addresses) {
        JsonArray array = new JsonArray();
        addresses.forEach(address -> array.add(address.value()));
        return array;
    }
}

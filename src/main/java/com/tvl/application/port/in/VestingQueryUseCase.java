package com.tvl.application.port.in;

import com.tvl.domain.model.Address;
import com.tvl.domain.model.Role;
import com.tvl.domain.model.ScheduleId;
import com.tvl.domain.model.VestingInfo;
import com.tvl.domain.model.VestingSchedule;
import com.tvl.domain.model.VestingTotals;
import io.vertx.core.Future;

import java.util.List;

/**
 * Input port for reading the vesting engine
 */
public interface VestingQueryUseCase {

    Future<VestingSchedule> getVestingSchedule(ScheduleId scheduleId);

    /**
     * Total, released and currently releasable amounts plus the current phase.
     */
    Future<VestingInfo> getVestingInfo(ScheduleId scheduleId);

    Future<List<ScheduleId>> getSchedulesForBeneficiary(Address beneficiary);

    Future<VestingTotals> getTotals();

    Future<Boolean> isPaused();

    Future<Boolean> hasRole(Role role, Address account);
}

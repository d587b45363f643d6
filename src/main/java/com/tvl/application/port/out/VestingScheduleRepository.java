package com.tvl.application.port.out;

import com.tvl.domain.model.Address;
import com.tvl.domain.model.AllocationId;
import com.tvl.domain.model.ScheduleId;
import com.tvl.domain.model.VestingSchedule;

import java.util.List;
import java.util.Optional;

/**
 * Output port for vesting schedule storage.
 * Append-only table keyed by sequential id plus beneficiary and allocation indexes.
 */
public interface VestingScheduleRepository {

    ScheduleId nextId();

    void save(VestingSchedule schedule);

    Optional<VestingSchedule> findById(ScheduleId id);

    List<ScheduleId> findIdsByBeneficiary(Address beneficiary);

    /**
     * Schedule backed by the given allocation, if any.
     */
    Optional<ScheduleId> findIdByAllocation(AllocationId allocationId);

    long count();
}

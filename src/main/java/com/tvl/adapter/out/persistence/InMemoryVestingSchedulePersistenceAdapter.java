package com.tvl.adapter.out.persistence;

import com.tvl.application.port.out.VestingScheduleRepository;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.AllocationId;
import com.tvl.domain.model.ScheduleId;
import com.tvl.domain.model.VestingSchedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory vesting schedule table, same layout as the allocation table.
 */
public class InMemoryVestingSchedulePersistenceAdapter implements VestingScheduleRepository {

    private final List<VestingSchedule> table = new ArrayList<>();
    private final Map<Address, List<ScheduleId>> byBeneficiary = new HashMap<>();
    private final Map<AllocationId, ScheduleId> byAllocation = new HashMap<>();

    @Override
    public ScheduleId nextId() {
        return ScheduleId.of(table.size() + 1L);
    }

    @Override
    public void save(VestingSchedule schedule) {
        if (!schedule.getId().equals(nextId())) {
            throw new IllegalStateException("Expected schedule id " + nextId() + " but got " + schedule.getId());
        }
        table.add(schedule);
        byBeneficiary.computeIfAbsent(schedule.getBeneficiary(), b -> new ArrayList<>()).add(schedule.getId());
        if (schedule.isLinkedToAllocation()) {
            byAllocation.putIfAbsent(schedule.getAllocationId(), schedule.getId());
        }
    }

    @Override
    public Optional<VestingSchedule> findById(ScheduleId id) {
        if (id == null || id.isNone() || id.value() > table.size()) {
            return Optional.empty();
        }
        return Optional.of(table.get((int) (id.value() - 1)));
    }

    @Override
    public List<ScheduleId> findIdsByBeneficiary(Address beneficiary) {
        List<ScheduleId> ids = byBeneficiary.get(beneficiary);
        return ids == null ? Collections.emptyList() : Collections.unmodifiableList(ids);
    }

    @Override
    public Optional<ScheduleId> findIdByAllocation(AllocationId allocationId) {
        return Optional.ofNullable(byAllocation.get(allocationId));
    }

    @Override
    public long count() {
        return table.size();
    }
}

package com.tvl.adapter.out.persistence;

import com.tvl.domain.model.AllocationId;
import com.tvl.domain.model.ScheduleId;
import com.tvl.domain.model.VestingSchedule;
import com.tvl.support.Accounts;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVestingSchedulePersistenceAdapterTest {

    private final InMemoryVestingSchedulePersistenceAdapter repository = new InMemoryVestingSchedulePersistenceAdapter();

    private VestingSchedule schedule(ScheduleId id) {
        return VestingSchedule.builder()
                .id(id)
                .beneficiary(Accounts.ALICE)
                .totalAmount(BigInteger.TEN)
                .startTime(0L)
                .duration(10L)
                .build();
    }

    @Test
    void save_shouldAppendInIdOrder() {
        assertEquals(ScheduleId.of(1), repository.nextId());
        repository.save(schedule(repository.nextId()));
        repository.save(schedule(repository.nextId()));

        assertEquals(2, repository.count());
        assertEquals(ScheduleId.of(3), repository.nextId());
        assertEquals(List.of(ScheduleId.of(1), ScheduleId.of(2)), repository.findIdsByBeneficiary(Accounts.ALICE));
        assertTrue(repository.findIdsByBeneficiary(Accounts.BOB).isEmpty());
    }

    @Test
    void save_shouldRejectOutOfOrderIds() {
        assertThrows(IllegalStateException.class, () -> repository.save(schedule(ScheduleId.of(2))));
        assertEquals(0, repository.count());
    }

    @Test
    void findById_shouldIgnoreUnknownIds() {
        repository.save(schedule(repository.nextId()));

        assertTrue(repository.findById(ScheduleId.of(1)).isPresent());
        assertTrue(repository.findById(ScheduleId.NONE).isEmpty());
        assertTrue(repository.findById(ScheduleId.of(2)).isEmpty());
    }

    @Test
    void findIdByAllocation_shouldIndexLinkedSchedulesOnly() {
        repository.save(schedule(repository.nextId()));
        repository.save(schedule(repository.nextId()).toBuilder().allocationId(AllocationId.of(5)).build());

        assertEquals(ScheduleId.of(2), repository.findIdByAllocation(AllocationId.of(5)).orElseThrow());
        assertTrue(repository.findIdByAllocation(AllocationId.of(6)).isEmpty());
        assertTrue(repository.findIdByAllocation(AllocationId.NONE).isEmpty());
    }
}

package com.tvl.domain.model;

import com.tvl.support.Accounts;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for VestingSchedule entity
 */
class VestingScheduleTest {

    private VestingSchedule schedule() {
        return VestingSchedule.builder()
                .id(ScheduleId.of(7))
                .beneficiary(Accounts.BOB)
                .totalAmount(BigInteger.valueOf(1000))
                .startTime(2000L)
                .cliffDuration(100L)
                .duration(400L)
                .createdAt(1500L)
                .build();
    }

    @Test
    void testDefaults() {
        VestingSchedule schedule = schedule();

        assertEquals(ScheduleStatus.ACTIVE, schedule.getStatus());
        assertEquals(BigInteger.ZERO, schedule.getReleasedAmount());
        assertEquals(AllocationId.NONE, schedule.getAllocationId());
        assertFalse(schedule.isLinkedToAllocation());
        assertEquals(2100L, schedule.getCliffEnd());
        assertEquals(2400L, schedule.getEndTime());
    }

    @Test
    void testReleaseCompletesWhenFullyReleased() {
        VestingSchedule schedule = schedule();

        schedule.release(BigInteger.valueOf(400));
        assertEquals(ScheduleStatus.ACTIVE, schedule.getStatus());
        assertEquals(BigInteger.valueOf(600), schedule.getUnreleasedAmount());

        schedule.release(BigInteger.valueOf(600));
        assertEquals(ScheduleStatus.COMPLETED, schedule.getStatus());
        assertTrue(schedule.isFullyReleased());
        assertTrue(schedule.isRevoked());
        assertThrows(IllegalStateException.class, () -> schedule.release(BigInteger.ONE));
    }

    @Test
    void testReleaseCannotExceedRemainder() {
        VestingSchedule schedule = schedule();

        assertThrows(IllegalStateException.class, () -> schedule.release(BigInteger.valueOf(1001)));
        assertThrows(IllegalStateException.class, () -> schedule.release(BigInteger.ZERO));
        assertEquals(BigInteger.ZERO, schedule.getReleasedAmount());
    }

    @Test
    void testRevoke() {
        VestingSchedule schedule = schedule();

        schedule.revoke();
        assertEquals(ScheduleStatus.REVOKED, schedule.getStatus());
        assertTrue(schedule.isRevoked());
        assertThrows(IllegalStateException.class, schedule::revoke);
    }

    @Test
    void testSnapshotIsDetached() {
        VestingSchedule schedule = schedule();
        VestingSchedule snapshot = schedule.snapshot();

        schedule.release(BigInteger.valueOf(10));

        assertEquals(BigInteger.ZERO, snapshot.getReleasedAmount());
        assertEquals(BigInteger.valueOf(10), schedule.getReleasedAmount());
    }
}

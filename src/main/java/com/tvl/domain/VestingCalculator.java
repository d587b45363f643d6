package com.tvl.domain;

import com.tvl.domain.model.ScheduleStatus;
import com.tvl.domain.model.VestingPhase;
import com.tvl.domain.model.VestingSchedule;

import java.math.BigInteger;

/**
 * Release curve of a vesting schedule: nothing before the cliff, linear between start and end,
 * the whole remainder from the end on.
 * Partial periods are truncated, never rounded up in favour of the beneficiary.
 */
public final class VestingCalculator {

    private VestingCalculator() {
    }

    /**
     * Amount the beneficiary may release at {@code now} (epoch seconds).
     */
    public static BigInteger releasableAmount(VestingSchedule schedule, long now) {
        if (schedule.isTerminal()) {
            return BigInteger.ZERO;
        }
        if (now < schedule.getCliffEnd()) {
            return BigInteger.ZERO;
        }
        if (now >= schedule.getEndTime()) {
            return schedule.getUnreleasedAmount();
        }
        BigInteger vested = vestedAmount(schedule, now);
        BigInteger releasable = vested.subtract(schedule.getReleasedAmount());
        // Manual unlocks can push released above the curve
        return releasable.signum() > 0 ? releasable : BigInteger.ZERO;
    }

    /**
     * Amount vested by the linear curve at {@code now}, ignoring the cliff and past releases.
     */
    public static BigInteger vestedAmount(VestingSchedule schedule, long now) {
        if (now <= schedule.getStartTime()) {
            return BigInteger.ZERO;
        }
        if (now >= schedule.getEndTime()) {
            return schedule.getTotalAmount();
        }
        BigInteger elapsed = BigInteger.valueOf(now - schedule.getStartTime());
        return schedule.getTotalAmount()
                .multiply(elapsed)
                .divide(BigInteger.valueOf(schedule.getDuration()));
    }

    public static VestingPhase phase(VestingSchedule schedule, long now) {
        if (schedule.getStatus() == ScheduleStatus.REVOKED) {
            return VestingPhase.REVOKED;
        }
        if (schedule.getStatus() == ScheduleStatus.COMPLETED) {
            return VestingPhase.COMPLETED;
        }
        if (now < schedule.getCliffEnd()) {
            return VestingPhase.PENDING;
        }
        if (now >= schedule.getEndTime()) {
            return VestingPhase.FULLY_VESTED;
        }
        return VestingPhase.VESTING;
    }
}

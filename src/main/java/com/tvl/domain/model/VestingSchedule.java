package com.tvl.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * Vesting schedule entity - a cliff plus linear release curve over {@code totalAmount}.
 * {@code releasedAmount} only grows and never passes {@code totalAmount}.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "id")
public class VestingSchedule {
    private final ScheduleId id;
    private final Address beneficiary;
    private final BigInteger totalAmount;
    private final long startTime;        // Epoch seconds
    private final long cliffDuration;    // Seconds
    private final long duration;         // Seconds
    private final long createdAt;        // Epoch seconds
    private final AllocationId allocationId;  // NONE = direct mint
    private BigInteger releasedAmount;
    private ScheduleStatus status;

    @Builder(toBuilder = true)
    private VestingSchedule(
            ScheduleId id,
            Address beneficiary,
            BigInteger totalAmount,
            long startTime,
            long cliffDuration,
            long duration,
            long createdAt,
            AllocationId allocationId,
            BigInteger releasedAmount,
            ScheduleStatus status
    ) {
        if (id == null || id.isNone()) {
            throw new IllegalArgumentException("Schedule id must be assigned");
        }
        this.id = id;
        this.beneficiary = beneficiary;
        this.totalAmount = totalAmount;
        this.startTime = startTime;
        this.cliffDuration = cliffDuration;
        this.duration = duration;
        this.createdAt = createdAt;
        this.allocationId = allocationId != null ? allocationId : AllocationId.NONE;
        this.releasedAmount = releasedAmount != null ? releasedAmount : BigInteger.ZERO;
        this.status = status != null ? status : ScheduleStatus.ACTIVE;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Compatibility view: completed and revoked schedules both report as revoked.
     */
    public boolean isRevoked() {
        return status.isTerminal();
    }

    public boolean isLinkedToAllocation() {
        return !allocationId.isNone();
    }

    public boolean isFullyReleased() {
        return releasedAmount.compareTo(totalAmount) >= 0;
    }

    public BigInteger getUnreleasedAmount() {
        return totalAmount.subtract(releasedAmount);
    }

    public long getCliffEnd() {
        return startTime + cliffDuration;
    }

    public long getEndTime() {
        return startTime + duration;
    }

    /**
     * Record a release. Completes the schedule once everything has been released.
     */
    public void release(BigInteger amount) {
        if (isTerminal()) {
            throw new IllegalStateException("Schedule " + id + " is " + status);
        }
        if (amount.signum() <= 0 || amount.compareTo(getUnreleasedAmount()) > 0) {
            throw new IllegalStateException("Schedule " + id + " cannot release " + amount);
        }
        this.releasedAmount = releasedAmount.add(amount);
        if (isFullyReleased()) {
            this.status = ScheduleStatus.COMPLETED;
        }
    }

    public void revoke() {
        if (isTerminal()) {
            throw new IllegalStateException("Schedule " + id + " is " + status);
        }
        this.status = ScheduleStatus.REVOKED;
    }

    public VestingSchedule snapshot() {
        return toBuilder().build();
    }
}

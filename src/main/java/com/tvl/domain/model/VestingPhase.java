package com.tvl.domain.model;

/**
 * Phase of a vesting schedule at a given point in time.
 */
public enum VestingPhase {
    /** Cliff not reached yet, nothing releasable */
    PENDING,
    /** Inside the linear window */
    VESTING,
    /** End of the schedule reached, the whole remainder is releasable */
    FULLY_VESTED,
    COMPLETED,
    REVOKED
}

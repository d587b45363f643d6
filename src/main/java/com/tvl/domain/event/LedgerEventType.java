package com.tvl.domain.event;

/**
 * Kinds of events raised by the ledgers.
 */
public enum LedgerEventType {
    ALLOCATION_CREATED,
    ALLOCATION_REVOKED,
    ALLOCATION_REDUCED,
    AIRDROP_EXECUTED,
    MANAGER_ASSIGNED,
    MANAGER_REMOVED,
    SCHEDULE_CREATED,
    TOKENS_RELEASED,
    MANUAL_UNLOCK,
    SCHEDULE_REVOKED,
    ALLOCATION_REDUCTION_SKIPPED,
    VESTING_TOTALS_UPDATED,
    ROLE_GRANTED,
    ROLE_REVOKED,
    PAUSED,
    UNPAUSED
}

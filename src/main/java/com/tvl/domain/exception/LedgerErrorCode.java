package com.tvl.domain.exception;

/**
 * Named failure conditions of the allocation ledger, the vesting engine and the token ledger.
 */
public enum LedgerErrorCode {
    // Authorization
    NOT_AUTHORIZED(ErrorCategory.AUTHORIZATION, "Caller is not authorized"),
    NOT_BENEFICIARY(ErrorCategory.AUTHORIZATION, "Caller is not the schedule beneficiary"),
    CANNOT_ADD_SELF(ErrorCategory.AUTHORIZATION, "Caller cannot add itself as manager"),
    CANNOT_REMOVE_SELF(ErrorCategory.AUTHORIZATION, "Caller cannot remove itself as manager"),

    // Invalid input
    INVALID_ADDRESS(ErrorCategory.INVALID_INPUT, "Address is invalid"),
    INVALID_BENEFICIARY(ErrorCategory.INVALID_INPUT, "Beneficiary is the zero address"),
    INVALID_AMOUNT(ErrorCategory.INVALID_INPUT, "Amount is invalid"),
    INVALID_DURATION(ErrorCategory.INVALID_INPUT, "Duration is invalid"),
    INVALID_START_TIME(ErrorCategory.INVALID_INPUT, "Start time is in the past"),
    EMPTY_BENEFICIARIES_LIST(ErrorCategory.INVALID_INPUT, "Beneficiaries list is empty"),
    ARRAYS_LENGTH_MISMATCH(ErrorCategory.INVALID_INPUT, "Beneficiaries and amounts differ in length"),

    // Invalid reference
    INVALID_ALLOCATION_ID(ErrorCategory.INVALID_REFERENCE, "Allocation does not exist"),
    INVALID_SCHEDULE_ID(ErrorCategory.INVALID_REFERENCE, "Vesting schedule does not exist"),
    ALLOCATION_BENEFICIARY_MISMATCH(ErrorCategory.INVALID_REFERENCE, "Allocation belongs to another beneficiary"),

    // State conflict
    ALLOCATION_ALREADY_REVOKED(ErrorCategory.STATE_CONFLICT, "Allocation is already revoked"),
    ALLOCATION_CONSUMED(ErrorCategory.STATE_CONFLICT, "Allocation was paid out by an airdrop"),
    ALLOCATION_ALREADY_LINKED(ErrorCategory.STATE_CONFLICT, "Allocation already backs a vesting schedule"),
    SCHEDULE_REVOKED(ErrorCategory.STATE_CONFLICT, "Vesting schedule is revoked or completed"),
    NO_TOKENS_DUE(ErrorCategory.STATE_CONFLICT, "No tokens are due for release"),
    EXCEEDS_REMAINING(ErrorCategory.STATE_CONFLICT, "Amount exceeds the unreleased remainder"),
    INSUFFICIENT_ALLOCATION(ErrorCategory.STATE_CONFLICT, "Allocation remainder is lower than the requested amount"),
    NOTHING_TO_REVOKE(ErrorCategory.STATE_CONFLICT, "Vesting schedule has no unvested remainder"),
    MAX_SUPPLY_EXCEEDED(ErrorCategory.STATE_CONFLICT, "Mint would exceed the maximum token supply"),
    REENTRANT_CALL(ErrorCategory.STATE_CONFLICT, "Reentrant call into a guarded ledger operation"),
    EXPECTED_PAUSE(ErrorCategory.STATE_CONFLICT, "Ledger is not paused"),

    // System halted
    ENFORCED_PAUSE(ErrorCategory.SYSTEM_HALTED, "Ledger is paused");

    private final ErrorCategory category;
    private final String description;

    LedgerErrorCode(ErrorCategory category, String description) {
        this.category = category;
        this.description = description;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }
}

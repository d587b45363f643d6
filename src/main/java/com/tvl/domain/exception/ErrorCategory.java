package com.tvl.domain.exception;

/**
 * Coarse classification of ledger failures.
 * Every {@link LedgerErrorCode} belongs to exactly one category.
 */
public enum ErrorCategory {
    AUTHORIZATION,
    INVALID_INPUT,
    INVALID_REFERENCE,
    STATE_CONFLICT,
    SYSTEM_HALTED
}

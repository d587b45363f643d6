package com.tvl.domain.exception;

/**
 * Failure of a ledger operation.
 * The operation that raised it has left no partial state behind.
 */
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    public LedgerException(LedgerErrorCode code) {
        this(code, code.getDescription());
    }

    public LedgerException(LedgerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public LedgerErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }

    public boolean is(LedgerErrorCode expected) {
        return code == expected;
    }

    @Override
    public String toString() {
        return "LedgerException[" + code + "]: " + getMessage();
    }
}

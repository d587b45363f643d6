package com.tvl.adapter.in.web.dto;

import com.tvl.domain.exception.LedgerErrorCode;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.AllocationId;
import com.tvl.domain.model.ScheduleId;
import io.vertx.ext.web.RoutingContext;

import java.math.BigInteger;

/**
 * Turns path parameters, headers and body fields into ledger types.
 * Malformed values surface as INVALID_INPUT ledger failures.
 */
public final class RequestParsing {

    public static final String CALLER_HEADER = "X-Caller-Address";

    private RequestParsing() {
    }

    public static Address caller(RoutingContext context) {
        String header = context.request().getHeader(CALLER_HEADER);
        if (header == null || header.isBlank()) {
            throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS, CALLER_HEADER + " header is required");
        }
        return Address.of(header);
    }

    public static Address address(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS, field + " is required");
        }
        return Address.of(value);
    }

    public static BigInteger amount(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, field + " is required");
        }
        try {
            BigInteger amount = new BigInteger(value.trim());
            if (amount.signum() < 0) {
                throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, field + " must not be negative");
            }
            return amount;
        } catch (NumberFormatException e) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, field + " must be an integer amount: " + value);
        }
    }

    public static long unsigned(String value, String field, LedgerErrorCode onError) {
        try {
            long parsed = Long.parseLong(value);
            if (parsed < 0) {
                throw new NumberFormatException("negative");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new LedgerException(onError, field + " must be a non-negative integer: " + value);
        }
    }

    public static AllocationId allocationId(RoutingContext context) {
        return AllocationId.of(unsigned(context.pathParam("id"), "allocation id", LedgerErrorCode.INVALID_ALLOCATION_ID));
    }

    public static ScheduleId scheduleId(RoutingContext context) {
        return ScheduleId.of(unsigned(context.pathParam("id"), "schedule id", LedgerErrorCode.INVALID_SCHEDULE_ID));
    }
}

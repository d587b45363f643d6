package com.tvl.domain.model;

import com.tvl.domain.exception.LedgerErrorCode;
import com.tvl.domain.exception.LedgerException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 20-byte account address, held as a lower case 0x-prefixed hex string.
 */
public record Address(String value) {

    private static final Pattern HEX_ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        if (value == null) {
            throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS, "Address is required");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
        if (!HEX_ADDRESS.matcher(value).matches()) {
            throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS, "Invalid address: " + value);
        }
    }

    public static Address of(String value) {
        return new Address(value);
    }

    public static boolean isValid(String value) {
        return value != null && HEX_ADDRESS.matcher(value.trim().toLowerCase(Locale.ROOT)).matches();
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    @Override
    public String toString() {
        return value;
    }
}

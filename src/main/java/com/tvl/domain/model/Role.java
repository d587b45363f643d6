package com.tvl.domain.model;

/**
 * Capabilities a caller can hold on a ledger.
 */
public enum Role {
    ADMIN("ADMIN"),
    VESTING_ADMIN("VESTING_ADMIN"),
    MANUAL_UNLOCK("MANUAL_UNLOCK");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Role fromValue(String value) {
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }

    public static boolean isValid(String value) {
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}

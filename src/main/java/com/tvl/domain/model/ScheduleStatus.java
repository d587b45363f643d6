package com.tvl.domain.model;

/**
 * Stored lifecycle status of a vesting schedule.
 * COMPLETED and REVOKED are both terminal: no further release is ever possible.
 */
public enum ScheduleStatus {
    ACTIVE("ACTIVE"),
    COMPLETED("COMPLETED"),
    REVOKED("REVOKED");

    private final String value;

    ScheduleStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    public static ScheduleStatus fromValue(String value) {
        for (ScheduleStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown schedule status: " + value);
    }
}

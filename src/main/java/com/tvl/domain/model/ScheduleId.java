package com.tvl.domain.model;

/**
 * Sequential vesting schedule identifier, 1-based. {@link #NONE} (0) is never a valid schedule.
 */
public record ScheduleId(long value) {

    public static final ScheduleId NONE = new ScheduleId(0);

    public ScheduleId {
        if (value < 0) {
            throw new IllegalArgumentException("Schedule id must not be negative: " + value);
        }
    }

    public static ScheduleId of(long value) {
        return value == 0 ? NONE : new ScheduleId(value);
    }

    public boolean isNone() {
        return value == 0;
    }

    public ScheduleId next() {
        return new ScheduleId(Math.addExact(value, 1));
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}

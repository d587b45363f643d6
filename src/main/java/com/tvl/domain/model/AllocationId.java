package com.tvl.domain.model;

/**
 * Sequential allocation identifier, 1-based. {@link #NONE} (0) means "no allocation".
 */
public record AllocationId(long value) {

    public static final AllocationId NONE = new AllocationId(0);

    public AllocationId {
        if (value < 0) {
            throw new IllegalArgumentException("Allocation id must not be negative: " + value);
        }
    }

    public static AllocationId of(long value) {
        return value == 0 ? NONE : new AllocationId(value);
    }

    public boolean isNone() {
        return value == 0;
    }

    public AllocationId next() {
        return new AllocationId(Math.addExact(value, 1));
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}

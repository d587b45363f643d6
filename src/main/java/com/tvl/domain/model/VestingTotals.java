package com.tvl.domain.model;

import lombok.Value;

import java.math.BigInteger;

/**
 * Running totals of the vesting engine: everything ever put under vesting and everything ever claimed.
 * Informational only, never used to decide an operation.
 */
@Value
public class VestingTotals {
    BigInteger totalVested;
    BigInteger totalClaimed;

    public static VestingTotals zero() {
        return new VestingTotals(BigInteger.ZERO, BigInteger.ZERO);
    }

    public VestingTotals addVested(BigInteger amount) {
        return new VestingTotals(totalVested.add(amount), totalClaimed);
    }

    public VestingTotals subtractVested(BigInteger amount) {
        BigInteger remaining = totalVested.subtract(amount);
        return new VestingTotals(remaining.signum() < 0 ? BigInteger.ZERO : remaining, totalClaimed);
    }

    public VestingTotals addClaimed(BigInteger amount) {
        return new VestingTotals(totalVested, totalClaimed.add(amount));
    }
}

package com.tvl.domain.model;

import lombok.Value;

import java.math.BigInteger;

/**
 * Point-in-time view of a schedule for beneficiaries and reporting.
 */
@Value
public class VestingInfo {
    ScheduleId scheduleId;
    Address beneficiary;
    BigInteger totalAmount;
    BigInteger releasedAmount;
    BigInteger releasableAmount;
    VestingPhase phase;
    long asOf;
}

package com.tvl.application.port.in;

import com.tvl.domain.model.Address;
import com.tvl.domain.model.AllocationId;
import com.tvl.domain.model.Role;
import com.tvl.domain.model.ScheduleId;
import io.vertx.core.Future;

import java.math.BigInteger;
import java.util.List;

/**
 * Input port for the vesting engine
 */
public interface VestingUseCase {

    /**
     * @return Future with the new schedule id
     */
    Future<ScheduleId> createVestingSchedule(CreateVestingScheduleCommand command);

    /**
     * Release everything currently due to the beneficiary.
     * @return Future with the released amount
     */
    Future<BigInteger> claimVestedTokens(Address caller, ScheduleId scheduleId);

    /**
     * Release an arbitrary amount outside the vesting curve.
     */
    Future<Boolean> manualUnlock(Address caller, ScheduleId scheduleId, BigInteger amount);

    /**
     * Revoke a schedule and its linked allocation.
     * @return Future with the unvested remainder
     */
    Future<BigInteger> revokeSchedule(Address caller, ScheduleId scheduleId);

    /**
     * Revoke a schedule without touching its linked allocation.
     * @return Future with the unvested remainder
     */
    Future<BigInteger> forceRevokeSchedule(Address caller, ScheduleId scheduleId);

    /**
     * Force-revoke every usable id, skipping zero, unknown and terminal ones.
     * @return Future with the number of schedules revoked
     */
    Future<Integer> batchForceRevokeSchedules(Address caller, List<ScheduleId> scheduleIds);

    Future<Void> pause(Address caller);

    Future<Void> unpause(Address caller);

    Future<Void> grantRole(Address caller, Role role, Address account);

    Future<Void> revokeRole(Address caller, Role role, Address account);

    record CreateVestingScheduleCommand(
            Address caller,
            Address beneficiary,
            BigInteger totalAmount,
            long startTime,
            long cliffDuration,
            long duration,
            AllocationId allocationId
    ) {}
}

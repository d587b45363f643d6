package com.tvl.application.service;

import com.tvl.application.port.in.VestingQueryUseCase;
import com.tvl.application.port.in.VestingUseCase;
import com.tvl.application.port.out.AllocationLedger;
import com.tvl.application.port.out.LedgerEventPublisher;
import com.tvl.application.port.out.ManagerRegistry;
import com.tvl.application.port.out.TokenLedger;
import com.tvl.application.port.out.VestingScheduleRepository;
import com.tvl.domain.VestingCalculator;
import com.tvl.domain.event.LedgerEvent;
import com.tvl.domain.event.LedgerEventType;
import com.tvl.domain.exception.LedgerErrorCode;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.Allocation;
import com.tvl.domain.model.AllocationId;
import com.tvl.domain.model.Role;
import com.tvl.domain.model.ScheduleId;
import com.tvl.domain.model.VestingInfo;
import com.tvl.domain.model.VestingSchedule;
import com.tvl.domain.model.VestingTotals;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Application service implementing the vesting engine.
 *
 * <p>Schedule lifecycle: ACTIVE until fully released (COMPLETED) or revoked (REVOKED). Releases
 * mint first and book afterwards, so a refused mint leaves the schedule, the totals and the
 * linked allocation untouched. Shrinking the linked allocation after a mint is best effort:
 * a refusal is logged and published as ALLOCATION_REDUCTION_SKIPPED, the release stands.</p>
 */
@Slf4j
public class VestingEngineService implements VestingUseCase, VestingQueryUseCase {

    static final String LEDGER = "vesting";

    private final VestingScheduleRepository scheduleRepository;
    private final AllocationLedger allocationLedger;
    private final ManagerRegistry managerRegistry;
    private final TokenLedger tokenLedger;
    private final LedgerEventPublisher eventPublisher;
    private final LedgerGate gate;
    private final Clock clock;
    private final Address engineAddress;

    private VestingTotals totals = VestingTotals.zero();

    public VestingEngineService(
            VestingScheduleRepository scheduleRepository,
            AllocationLedger allocationLedger,
            ManagerRegistry managerRegistry,
            TokenLedger tokenLedger,
            LedgerEventPublisher eventPublisher,
            LedgerGate gate,
            Clock clock,
            Address engineAddress
    ) {
        this.scheduleRepository = scheduleRepository;
        this.allocationLedger = allocationLedger;
        this.managerRegistry = managerRegistry;
        this.tokenLedger = tokenLedger;
        this.eventPublisher = eventPublisher;
        this.gate = gate;
        this.clock = clock;
        this.engineAddress = engineAddress;
    }

    @Override
    public Future<ScheduleId> createVestingSchedule(CreateVestingScheduleCommand command) {
        return gate.submit("createVestingSchedule", () -> {
            gate.requireNotPaused();
            requirePrivileged(command.caller(), Role.VESTING_ADMIN);
            validateSchedule(command);

            AllocationId allocationId = command.allocationId() != null ? command.allocationId() : AllocationId.NONE;
            if (!allocationId.isNone()) {
                validateAllocation(allocationId, command.beneficiary(), command.totalAmount());
            }

            ScheduleId id = scheduleRepository.nextId();
            VestingSchedule schedule = VestingSchedule.builder()
                    .id(id)
                    .beneficiary(command.beneficiary())
                    .totalAmount(command.totalAmount())
                    .startTime(command.startTime())
                    .cliffDuration(command.cliffDuration())
                    .duration(command.duration())
                    .createdAt(now())
                    .allocationId(allocationId)
                    .build();
            scheduleRepository.save(schedule);
            totals = totals.addVested(schedule.getTotalAmount());

            log.info("Vesting schedule {} created for {}: {} from {} (cliff {}s, duration {}s, allocation {})",
                    id, schedule.getBeneficiary(), schedule.getTotalAmount(), schedule.getStartTime(),
                    schedule.getCliffDuration(), schedule.getDuration(), allocationId);
            publish(LedgerEvent.builder()
                    .type(LedgerEventType.SCHEDULE_CREATED)
                    .referenceId(id.value())
                    .account(schedule.getBeneficiary())
                    .amount(schedule.getTotalAmount())
                    .attribute("allocationId", allocationId.toString())
                    .attribute("startTime", Long.toString(schedule.getStartTime()))
                    .attribute("cliffDuration", Long.toString(schedule.getCliffDuration()))
                    .attribute("duration", Long.toString(schedule.getDuration())));
            publishTotals();
            return id;
        });
    }

    @Override
    public Future<BigInteger> claimVestedTokens(Address caller, ScheduleId scheduleId) {
        return gate.submit("claimVestedTokens", () -> {
            gate.requireNotPaused();
            VestingSchedule schedule = requireActiveSchedule(scheduleId);
            if (!schedule.getBeneficiary().equals(caller)) {
                throw new LedgerException(LedgerErrorCode.NOT_BENEFICIARY,
                        caller + " is not the beneficiary of schedule " + scheduleId);
            }
            BigInteger due = VestingCalculator.releasableAmount(schedule, now());
            if (due.signum() <= 0) {
                throw new LedgerException(LedgerErrorCode.NO_TOKENS_DUE, "Nothing is due on schedule " + scheduleId);
            }

            settleRelease(schedule, due, LedgerEventType.TOKENS_RELEASED);
            return due;
        });
    }

    @Override
    public Future<Boolean> manualUnlock(Address caller, ScheduleId scheduleId, BigInteger amount) {
        return gate.submit("manualUnlock", () -> {
            gate.requireNotPaused();
            requirePrivileged(caller, Role.MANUAL_UNLOCK);
            VestingSchedule schedule = requireActiveSchedule(scheduleId);
            if (amount == null || amount.signum() <= 0) {
                throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "Unlock amount must be greater than zero");
            }
            if (amount.compareTo(schedule.getUnreleasedAmount()) > 0) {
                throw new LedgerException(LedgerErrorCode.EXCEEDS_REMAINING,
                        "Unlock of " + amount + " exceeds the " + schedule.getUnreleasedAmount() + " left on schedule " + scheduleId);
            }

            settleRelease(schedule, amount, LedgerEventType.MANUAL_UNLOCK);
            log.info("Manual unlock of {} on schedule {} by {}", amount, scheduleId, caller);
            return true;
        });
    }

    /**
     * Revokes the linked allocation first; if the allocation ledger refuses, the schedule stays as it was.
     */
    @Override
    public Future<BigInteger> revokeSchedule(Address caller, ScheduleId scheduleId) {
        return gate.submit("revokeSchedule", () -> {
            gate.requireNotPaused();
            requirePrivileged(caller, Role.VESTING_ADMIN);
            VestingSchedule schedule = requireActiveSchedule(scheduleId);
            BigInteger unvested = schedule.getUnreleasedAmount();
            if (unvested.signum() <= 0) {
                throw new LedgerException(LedgerErrorCode.NOTHING_TO_REVOKE,
                        "Schedule " + scheduleId + " has nothing left to revoke");
            }

            if (schedule.isLinkedToAllocation()) {
                allocationLedger.revokeAllocation(engineAddress, schedule.getAllocationId());
            }
            return applyRevocation(schedule, false);
        });
    }

    @Override
    public Future<BigInteger> forceRevokeSchedule(Address caller, ScheduleId scheduleId) {
        return gate.submit("forceRevokeSchedule", () -> {
            gate.requireNotPaused();
            gate.requireRole(caller, Role.ADMIN);
            VestingSchedule schedule = requireActiveSchedule(scheduleId);
            return applyRevocation(schedule, true);
        });
    }

    @Override
    public Future<Integer> batchForceRevokeSchedules(Address caller, List<ScheduleId> scheduleIds) {
        return gate.submit("batchForceRevokeSchedules", () -> {
            gate.requireNotPaused();
            gate.requireRole(caller, Role.ADMIN);
            if (scheduleIds == null || scheduleIds.isEmpty()) {
                return 0;
            }

            int revoked = 0;
            for (ScheduleId scheduleId : scheduleIds) {
                if (scheduleId == null || scheduleId.isNone()) {
                    log.debug("Batch revoke skipped schedule id 0");
                    continue;
                }
                Optional<VestingSchedule> schedule = scheduleRepository.findById(scheduleId);
                if (schedule.isEmpty()) {
                    log.debug("Batch revoke skipped unknown schedule {}", scheduleId);
                    continue;
                }
                if (schedule.get().isTerminal()) {
                    log.debug("Batch revoke skipped schedule {} in status {}", scheduleId, schedule.get().getStatus());
                    continue;
                }
                applyRevocation(schedule.get(), true);
                revoked++;
            }
            log.info("Batch force revoke by {}: {} of {} schedules revoked", caller, revoked, scheduleIds.size());
            return revoked;
        });
    }

    @Override
    public Future<Void> pause(Address caller) {
        return gate.submit("pause", () -> {
            gate.requireRole(caller, Role.ADMIN);
            gate.pause();
            publish(LedgerEvent.builder().type(LedgerEventType.PAUSED).account(caller));
            return null;
        });
    }

    @Override
    public Future<Void> unpause(Address caller) {
        return gate.submit("unpause", () -> {
            gate.requireRole(caller, Role.ADMIN);
            gate.unpause();
            publish(LedgerEvent.builder().type(LedgerEventType.UNPAUSED).account(caller));
            return null;
        });
    }

    @Override
    public Future<Void> grantRole(Address caller, Role role, Address account) {
        return gate.submit("grantRole", () -> {
            gate.requireRole(caller, Role.ADMIN);
            if (gate.grantRole(role, account)) {
                log.info("Role {} granted to {} by {}", role.getValue(), account, caller);
                publish(LedgerEvent.builder()
                        .type(LedgerEventType.ROLE_GRANTED)
                        .account(account)
                        .attribute("role", role.getValue()));
            }
            return null;
        });
    }

    @Override
    public Future<Void> revokeRole(Address caller, Role role, Address account) {
        return gate.submit("revokeRole", () -> {
            gate.requireRole(caller, Role.ADMIN);
            if (gate.revokeRole(role, account)) {
                log.info("Role {} revoked from {} by {}", role.getValue(), account, caller);
                publish(LedgerEvent.builder()
                        .type(LedgerEventType.ROLE_REVOKED)
                        .account(account)
                        .attribute("role", role.getValue()));
            }
            return null;
        });
    }

    // Queries

    @Override
    public Future<VestingSchedule> getVestingSchedule(ScheduleId scheduleId) {
        return gate.query(() -> requireSchedule(scheduleId).snapshot());
    }

    @Override
    public Future<VestingInfo> getVestingInfo(ScheduleId scheduleId) {
        return gate.query(() -> {
            VestingSchedule schedule = requireSchedule(scheduleId);
            long now = now();
            return new VestingInfo(
                    schedule.getId(),
                    schedule.getBeneficiary(),
                    schedule.getTotalAmount(),
                    schedule.getReleasedAmount(),
                    VestingCalculator.releasableAmount(schedule, now),
                    VestingCalculator.phase(schedule, now),
                    now
            );
        });
    }

    @Override
    public Future<List<ScheduleId>> getSchedulesForBeneficiary(Address beneficiary) {
        return gate.query(() -> List.copyOf(scheduleRepository.findIdsByBeneficiary(beneficiary)));
    }

    @Override
    public Future<VestingTotals> getTotals() {
        return gate.query(() -> totals);
    }

    @Override
    public Future<Boolean> isPaused() {
        return gate.query(gate::isPaused);
    }

    @Override
    public Future<Boolean> hasRole(Role role, Address account) {
        return gate.query(() -> gate.hasRole(role, account));
    }

    // Release and revocation

    private void settleRelease(VestingSchedule schedule, BigInteger amount, LedgerEventType type) {
        tokenLedger.mint(schedule.getBeneficiary(), amount);

        schedule.release(amount);
        totals = totals.addClaimed(amount);
        reduceLinkedAllocation(schedule, amount);

        log.info("Released {} on schedule {} to {} ({} of {} released, status {})",
                amount, schedule.getId(), schedule.getBeneficiary(),
                schedule.getReleasedAmount(), schedule.getTotalAmount(), schedule.getStatus());
        publish(LedgerEvent.builder()
                .type(type)
                .referenceId(schedule.getId().value())
                .account(schedule.getBeneficiary())
                .amount(amount)
                .attribute("releasedAmount", schedule.getReleasedAmount().toString())
                .attribute("status", schedule.getStatus().getValue()));
        publishTotals();
    }

    private void reduceLinkedAllocation(VestingSchedule schedule, BigInteger amount) {
        if (!schedule.isLinkedToAllocation()) {
            return;
        }
        AllocationId allocationId = schedule.getAllocationId();
        Optional<Allocation> allocation = allocationLedger.findAllocation(allocationId);
        if (allocation.isEmpty()) {
            recordSkippedReduction(schedule, amount, "allocation not found");
            return;
        }
        if (allocation.get().isRevoked()) {
            recordSkippedReduction(schedule, amount, "allocation revoked");
            return;
        }
        if (!allocation.get().covers(amount)) {
            recordSkippedReduction(schedule, amount, "allocation holds only " + allocation.get().getAmount());
            return;
        }
        try {
            allocationLedger.reduceAllocation(engineAddress, allocationId, amount);
        } catch (LedgerException e) {
            recordSkippedReduction(schedule, amount, e.getCode().name());
        }
    }

    private void recordSkippedReduction(VestingSchedule schedule, BigInteger amount, String reason) {
        log.warn("Allocation {} not reduced by {} after release on schedule {}: {}",
                schedule.getAllocationId(), amount, schedule.getId(), reason);
        publish(LedgerEvent.builder()
                .type(LedgerEventType.ALLOCATION_REDUCTION_SKIPPED)
                .referenceId(schedule.getId().value())
                .account(schedule.getBeneficiary())
                .amount(amount)
                .attribute("allocationId", schedule.getAllocationId().toString())
                .attribute("reason", reason));
    }

    private BigInteger applyRevocation(VestingSchedule schedule, boolean forced) {
        BigInteger unvested = schedule.getUnreleasedAmount();
        schedule.revoke();
        totals = totals.subtractVested(unvested);

        log.info("Vesting schedule {} {}revoked, {} unvested", schedule.getId(), forced ? "force-" : "", unvested);
        publish(LedgerEvent.builder()
                .type(LedgerEventType.SCHEDULE_REVOKED)
                .referenceId(schedule.getId().value())
                .account(schedule.getBeneficiary())
                .amount(unvested)
                .attribute("forced", Boolean.toString(forced)));
        publishTotals();
        return unvested;
    }

    // Validation

    private void validateSchedule(CreateVestingScheduleCommand command) {
        if (command.beneficiary() == null || command.beneficiary().isZero()) {
            throw new LedgerException(LedgerErrorCode.INVALID_BENEFICIARY);
        }
        if (command.totalAmount() == null || command.totalAmount().signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "Total amount must be greater than zero");
        }
        if (command.duration() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_DURATION, "Duration must be greater than zero");
        }
        if (command.cliffDuration() < 0 || command.duration() < command.cliffDuration()) {
            throw new LedgerException(LedgerErrorCode.INVALID_DURATION,
                    "Cliff of " + command.cliffDuration() + "s does not fit a duration of " + command.duration() + "s");
        }
        if (command.startTime() < now()) {
            throw new LedgerException(LedgerErrorCode.INVALID_START_TIME,
                    "Start time " + command.startTime() + " is before " + now());
        }
        try {
            Math.addExact(command.startTime(), command.duration());
        } catch (ArithmeticException e) {
            throw new LedgerException(LedgerErrorCode.INVALID_DURATION, "Schedule end overflows");
        }
    }

    private void validateAllocation(AllocationId allocationId, Address beneficiary, BigInteger totalAmount) {
        Allocation allocation = allocationLedger.findAllocation(allocationId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.INVALID_ALLOCATION_ID,
                        "Allocation " + allocationId + " does not exist"));
        if (!allocation.belongsTo(beneficiary)) {
            throw new LedgerException(LedgerErrorCode.ALLOCATION_BENEFICIARY_MISMATCH,
                    "Allocation " + allocationId + " belongs to " + allocation.getBeneficiary());
        }
        if (allocation.isRevoked()) {
            throw new LedgerException(LedgerErrorCode.ALLOCATION_ALREADY_REVOKED,
                    "Allocation " + allocationId + " is revoked");
        }
        if (allocation.isConsumed()) {
            throw new LedgerException(LedgerErrorCode.ALLOCATION_CONSUMED,
                    "Allocation " + allocationId + " was paid out by an airdrop");
        }
        scheduleRepository.findIdByAllocation(allocationId).ifPresent(linked -> {
            throw new LedgerException(LedgerErrorCode.ALLOCATION_ALREADY_LINKED,
                    "Allocation " + allocationId + " already backs schedule " + linked);
        });
        if (!allocation.covers(totalAmount)) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_ALLOCATION,
                    "Allocation " + allocationId + " holds " + allocation.getAmount() + ", schedule needs " + totalAmount);
        }
    }

    private void requirePrivileged(Address caller, Role operationRole) {
        if (caller == null) {
            throw new LedgerException(LedgerErrorCode.NOT_AUTHORIZED, "Caller is required");
        }
        if (gate.hasAnyRole(caller, Role.ADMIN, operationRole) || managerRegistry.isManager(caller)) {
            return;
        }
        throw new LedgerException(LedgerErrorCode.NOT_AUTHORIZED,
                caller + " holds neither " + operationRole.getValue() + " nor a manager seat");
    }

    private VestingSchedule requireSchedule(ScheduleId scheduleId) {
        if (scheduleId == null || scheduleId.isNone()) {
            throw new LedgerException(LedgerErrorCode.INVALID_SCHEDULE_ID, "Schedule id 0 is reserved");
        }
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.INVALID_SCHEDULE_ID,
                        "Schedule " + scheduleId + " does not exist"));
    }

    private VestingSchedule requireActiveSchedule(ScheduleId scheduleId) {
        VestingSchedule schedule = requireSchedule(scheduleId);
        if (schedule.isTerminal()) {
            throw new LedgerException(LedgerErrorCode.SCHEDULE_REVOKED,
                    "Schedule " + scheduleId + " is " + schedule.getStatus().getValue());
        }
        return schedule;
    }

    // Events

    private void publishTotals() {
        publish(LedgerEvent.builder()
                .type(LedgerEventType.VESTING_TOTALS_UPDATED)
                .amount(totals.getTotalVested())
                .attribute("totalVested", totals.getTotalVested().toString())
                .attribute("totalClaimed", totals.getTotalClaimed().toString()));
    }

    private void publish(LedgerEvent.LedgerEventBuilder event) {
        eventPublisher.publish(event.ledger(LEDGER).occurredAt(now()).build());
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}

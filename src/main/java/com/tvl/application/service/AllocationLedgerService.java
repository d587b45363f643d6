package com.tvl.application.service;

import com.tvl.application.port.in.AllocationQueryUseCase;
import com.tvl.application.port.in.AllocationUseCase;
import com.tvl.application.port.out.AllocationRepository;
import com.tvl.application.port.out.LedgerEventPublisher;
import com.tvl.application.port.out.TokenLedger;
import com.tvl.domain.event.LedgerEvent;
import com.tvl.domain.event.LedgerEventType;
import com.tvl.domain.exception.LedgerErrorCode;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.Allocation;
import com.tvl.domain.model.AllocationId;
import com.tvl.domain.model.Role;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Application service implementing the allocation ledger.
 *
 * <p>Owns allocation records and the manager registry. Every mutating operation runs
 * pause check, authorization, input validation and state checks in that order inside the
 * ledger gate, and only then writes.</p>
 */
@Slf4j
public class AllocationLedgerService implements AllocationUseCase, AllocationQueryUseCase {

    static final String LEDGER = "allocation";

    private final AllocationRepository allocationRepository;
    private final TokenLedger tokenLedger;
    private final LedgerEventPublisher eventPublisher;
    private final LedgerGate gate;
    private final Clock clock;

    private final Set<Address> managers = new LinkedHashSet<>();
    private long lastAirdropId;

    public AllocationLedgerService(
            AllocationRepository allocationRepository,
            TokenLedger tokenLedger,
            LedgerEventPublisher eventPublisher,
            LedgerGate gate,
            Clock clock
    ) {
        this.allocationRepository = allocationRepository;
        this.tokenLedger = tokenLedger;
        this.eventPublisher = eventPublisher;
        this.gate = gate;
        this.clock = clock;
    }

    @Override
    public Future<AllocationId> createAllocation(CreateAllocationCommand command) {
        return gate.submit("createAllocation", () -> {
            gate.requireNotPaused();
            requirePrivileged(command.caller());
            requireBeneficiary(command.beneficiary());
            requirePositive(command.amount());

            Allocation allocation = appendAllocation(
                    new Allocation(allocationRepository.nextId(), command.beneficiary(), command.amount(), now()));
            log.info("Allocation {} created for {}: {}", allocation.getId(), allocation.getBeneficiary(), allocation.getAmount());
            return allocation.getId();
        });
    }

    @Override
    public Future<Boolean> revokeAllocation(Address caller, AllocationId allocationId) {
        return gate.submit("revokeAllocation", () -> {
            gate.requireNotPaused();
            requirePrivileged(caller);
            Allocation allocation = requireAllocation(allocationId);
            if (allocation.isRevoked()) {
                throw new LedgerException(LedgerErrorCode.ALLOCATION_ALREADY_REVOKED,
                        "Allocation " + allocationId + " is already revoked");
            }

            allocation.revoke();
            log.info("Allocation {} revoked, {} left unusable", allocationId, allocation.getAmount());
            publish(LedgerEventType.ALLOCATION_REVOKED, allocation.getId().value(),
                    allocation.getBeneficiary(), allocation.getAmount());
            return true;
        });
    }

    @Override
    public Future<Boolean> reduceAllocation(Address caller, AllocationId allocationId, BigInteger amount) {
        return gate.submit("reduceAllocation", () -> {
            gate.requireNotPaused();
            requirePrivileged(caller);
            Allocation allocation = requireAllocation(allocationId);
            if (allocation.isRevoked()) {
                throw new LedgerException(LedgerErrorCode.ALLOCATION_ALREADY_REVOKED,
                        "Allocation " + allocationId + " is already revoked");
            }
            if (allocation.isConsumed()) {
                throw new LedgerException(LedgerErrorCode.ALLOCATION_CONSUMED,
                        "Allocation " + allocationId + " was paid out by an airdrop");
            }
            if (amount == null || amount.signum() <= 0 || !allocation.covers(amount)) {
                throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT,
                        "Cannot reduce allocation " + allocationId + " holding " + allocation.getAmount() + " by " + amount);
            }

            allocation.reduce(amount);
            log.debug("Allocation {} reduced by {}, {} remaining", allocationId, amount, allocation.getAmount());
            publish(LedgerEventType.ALLOCATION_REDUCED, allocation.getId().value(), allocation.getBeneficiary(), amount);
            return true;
        });
    }

    /**
     * Validates the whole batch, including its total against the remaining supply, before any
     * mint; allocation records are written only once every mint went through.
     */
    @Override
    public Future<Long> executeAirdrop(AirdropCommand command) {
        return gate.submit("executeAirdrop", () -> {
            gate.requireNotPaused();
            requirePrivileged(command.caller());

            List<Address> beneficiaries = command.beneficiaries();
            List<BigInteger> amounts = command.amounts();
            if (beneficiaries == null || beneficiaries.isEmpty()) {
                throw new LedgerException(LedgerErrorCode.EMPTY_BENEFICIARIES_LIST);
            }
            if (amounts == null || amounts.size() != beneficiaries.size()) {
                throw new LedgerException(LedgerErrorCode.ARRAYS_LENGTH_MISMATCH,
                        beneficiaries.size() + " beneficiaries but " + (amounts == null ? 0 : amounts.size()) + " amounts");
            }
            BigInteger total = BigInteger.ZERO;
            for (int i = 0; i < beneficiaries.size(); i++) {
                requireBeneficiary(beneficiaries.get(i));
                requirePositive(amounts.get(i));
                total = total.add(amounts.get(i));
            }

            BigInteger remaining = tokenLedger.remainingSupply();
            if (total.compareTo(remaining) > 0) {
                throw new LedgerException(LedgerErrorCode.MAX_SUPPLY_EXCEEDED,
                        "Airdrop of " + total + " exceeds the remaining supply of " + remaining);
            }

            for (int i = 0; i < beneficiaries.size(); i++) {
                try {
                    tokenLedger.mint(beneficiaries.get(i), amounts.get(i));
                } catch (LedgerException e) {
                    if (i > 0) {
                        log.error("Airdrop aborted at entry {} of {} after the supply check passed: {} mints already issued",
                                i, beneficiaries.size(), i);
                    }
                    throw e;
                }
            }

            long airdropId = ++lastAirdropId;
            for (int i = 0; i < beneficiaries.size(); i++) {
                appendAllocation(Allocation.airdropped(allocationRepository.nextId(), beneficiaries.get(i), amounts.get(i), now()));
            }

            log.info("Airdrop {} executed: {} beneficiaries, {} tokens", airdropId, beneficiaries.size(), total);
            eventPublisher.publish(LedgerEvent.builder()
                    .type(LedgerEventType.AIRDROP_EXECUTED)
                    .ledger(LEDGER)
                    .referenceId(airdropId)
                    .account(command.caller())
                    .amount(total)
                    .occurredAt(now())
                    .attribute("count", Integer.toString(beneficiaries.size()))
                    .build());
            return airdropId;
        });
    }

    @Override
    public Future<Void> addManager(Address caller, Address manager) {
        return gate.submit("addManager", () -> {
            gate.requireNotPaused();
            requirePrivileged(caller);
            if (manager == null || manager.isZero()) {
                throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS, "Manager must not be the zero address");
            }
            if (manager.equals(caller)) {
                throw new LedgerException(LedgerErrorCode.CANNOT_ADD_SELF);
            }
            if (managers.add(manager)) {
                log.info("Manager {} assigned by {}", manager, caller);
                publish(LedgerEventType.MANAGER_ASSIGNED, 0, manager, null);
            }
            return null;
        });
    }

    @Override
    public Future<Void> removeManager(Address caller, Address manager) {
        return gate.submit("removeManager", () -> {
            gate.requireNotPaused();
            requirePrivileged(caller);
            if (manager == null || manager.isZero()) {
                throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS, "Manager must not be the zero address");
            }
            if (manager.equals(caller)) {
                throw new LedgerException(LedgerErrorCode.CANNOT_REMOVE_SELF);
            }
            if (managers.remove(manager)) {
                log.info("Manager {} removed by {}", manager, caller);
                publish(LedgerEventType.MANAGER_REMOVED, 0, manager, null);
            }
            return null;
        });
    }

    @Override
    public Future<Void> pause(Address caller) {
        return gate.submit("pause", () -> {
            gate.requireRole(caller, Role.ADMIN);
            gate.pause();
            publish(LedgerEventType.PAUSED, 0, caller, null);
            return null;
        });
    }

    @Override
    public Future<Void> unpause(Address caller) {
        return gate.submit("unpause", () -> {
            gate.requireRole(caller, Role.ADMIN);
            gate.unpause();
            publish(LedgerEventType.UNPAUSED, 0, caller, null);
            return null;
        });
    }

    // Queries

    @Override
    public Future<Allocation> getAllocation(AllocationId allocationId) {
        return gate.query(() -> requireAllocation(allocationId).snapshot());
    }

    @Override
    public Future<List<AllocationId>> getAllocationsForBeneficiary(Address beneficiary) {
        return gate.query(() -> List.copyOf(allocationRepository.findIdsByBeneficiary(beneficiary)));
    }

    @Override
    public Future<Boolean> isManager(Address account) {
        return gate.query(() -> isPrivileged(account));
    }

    @Override
    public Future<List<Address>> getAllManagers() {
        return gate.query(() -> new ArrayList<>(managers));
    }

    @Override
    public Future<Boolean> isPaused() {
        return gate.query(gate::isPaused);
    }

    // Helpers

    private Allocation appendAllocation(Allocation allocation) {
        allocationRepository.save(allocation);
        publish(LedgerEventType.ALLOCATION_CREATED, allocation.getId().value(),
                allocation.getBeneficiary(), allocation.getAmount());
        return allocation;
    }

    private boolean isPrivileged(Address account) {
        return account != null && (gate.hasRole(Role.ADMIN, account) || managers.contains(account));
    }

    private void requirePrivileged(Address caller) {
        if (!isPrivileged(caller)) {
            throw new LedgerException(LedgerErrorCode.NOT_AUTHORIZED,
                    caller + " is neither admin nor manager of the allocation ledger");
        }
    }

    private Allocation requireAllocation(AllocationId allocationId) {
        if (allocationId == null || allocationId.isNone()) {
            throw new LedgerException(LedgerErrorCode.INVALID_ALLOCATION_ID, "Allocation id 0 is reserved");
        }
        return allocationRepository.findById(allocationId)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.INVALID_ALLOCATION_ID,
                        "Allocation " + allocationId + " does not exist"));
    }

    private static void requireBeneficiary(Address beneficiary) {
        if (beneficiary == null || beneficiary.isZero()) {
            throw new LedgerException(LedgerErrorCode.INVALID_BENEFICIARY);
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "Amount must be greater than zero");
        }
    }

    private void publish(LedgerEventType type, long referenceId, Address account, BigInteger amount) {
        eventPublisher.publish(LedgerEvent.builder()
                .type(type)
                .ledger(LEDGER)
                .referenceId(referenceId)
                .account(account)
                .amount(amount)
                .occurredAt(now())
                .build());
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}

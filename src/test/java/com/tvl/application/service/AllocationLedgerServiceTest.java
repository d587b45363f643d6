package com.tvl.application.service;

import com.tvl.adapter.out.ledger.InMemoryTokenLedgerAdapter;
import com.tvl.adapter.out.persistence.InMemoryAllocationPersistenceAdapter;
import com.tvl.application.port.in.AllocationUseCase.AirdropCommand;
import com.tvl.application.port.in.AllocationUseCase.CreateAllocationCommand;
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
import com.tvl.support.Accounts;
import com.tvl.support.MutableClock;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AllocationLedgerService
 * Uses the in-memory allocation table with a mocked token ledger and event publisher
 */
class AllocationLedgerServiceTest {

    @Mock
    private TokenLedger tokenLedger;

    @Mock
    private LedgerEventPublisher eventPublisher;

    private InMemoryAllocationPersistenceAdapter repository;
    private AllocationLedgerService service;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        repository = new InMemoryAllocationPersistenceAdapter();
        LedgerGate gate = new LedgerGate("allocation");
        gate.grantRole(Role.ADMIN, Accounts.ADMIN);
        service = new AllocationLedgerService(repository, tokenLedger, eventPublisher, gate, new MutableClock(1_700_000_000L));
        when(tokenLedger.remainingSupply()).thenReturn(amount(1_000_000));
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private static BigInteger amount(long value) {
        return BigInteger.valueOf(value);
    }

    private static LedgerErrorCode codeOf(Future<?> future) {
        assertTrue(future.failed(), "expected a failed future");
        return ((LedgerException) future.cause()).getCode();
    }

    @Test
    void createAllocation_shouldAssignSequentialIds() {
        Future<AllocationId> first = service.createAllocation(new CreateAllocationCommand(Accounts.ADMIN, Accounts.ALICE, amount(100)));
        Future<AllocationId> second = service.createAllocation(new CreateAllocationCommand(Accounts.ADMIN, Accounts.ALICE, amount(200)));

        assertTrue(first.succeeded());
        assertEquals(AllocationId.of(1), first.result());
        assertEquals(AllocationId.of(2), second.result());
        assertEquals(List.of(AllocationId.of(1), AllocationId.of(2)),
                service.getAllocationsForBeneficiary(Accounts.ALICE).result());

        Allocation stored = service.getAllocation(AllocationId.of(2)).result();
        assertEquals(amount(200), stored.getAmount());
        assertEquals(1_700_000_000L, stored.getCreatedAt());
        verify(tokenLedger, never()).mint(any(), any());
    }

    @Test
    void createAllocation_shouldRejectInvalidInput() {
        assertEquals(LedgerErrorCode.NOT_AUTHORIZED, codeOf(service.createAllocation(
                new CreateAllocationCommand(Accounts.STRANGER, Accounts.ALICE, amount(100)))));
        assertEquals(LedgerErrorCode.INVALID_BENEFICIARY, codeOf(service.createAllocation(
                new CreateAllocationCommand(Accounts.ADMIN, Address.ZERO, amount(100)))));
        assertEquals(LedgerErrorCode.INVALID_AMOUNT, codeOf(service.createAllocation(
                new CreateAllocationCommand(Accounts.ADMIN, Accounts.ALICE, BigInteger.ZERO))));

        // Failed creates consume no id
        assertEquals(0, repository.count());
        assertEquals(AllocationId.of(1), service.createAllocation(
                new CreateAllocationCommand(Accounts.ADMIN, Accounts.ALICE, amount(1))).result());
    }

    @Test
    void managerShouldBeAbleToCreateAllocations() {
        assertTrue(service.addManager(Accounts.ADMIN, Accounts.MANAGER).succeeded());

        Future<AllocationId> result = service.createAllocation(new CreateAllocationCommand(Accounts.MANAGER, Accounts.BOB, amount(5)));

        assertTrue(result.succeeded());
    }

    @Test
    void revokeAllocation_shouldRevokeOnce() {
        AllocationId id = service.createAllocation(new CreateAllocationCommand(Accounts.ADMIN, Accounts.ALICE, amount(100))).result();

        assertTrue(service.revokeAllocation(Accounts.ADMIN, id).result());
        assertTrue(service.getAllocation(id).result().isRevoked());
        assertEquals(LedgerErrorCode.ALLOCATION_ALREADY_REVOKED, codeOf(service.revokeAllocation(Accounts.ADMIN, id)));
        assertEquals(LedgerErrorCode.INVALID_ALLOCATION_ID, codeOf(service.revokeAllocation(Accounts.ADMIN, AllocationId.of(42))));
        assertEquals(LedgerErrorCode.INVALID_ALLOCATION_ID, codeOf(service.revokeAllocation(Accounts.ADMIN, AllocationId.NONE)));
    }

    @Test
    void reduceAllocation_shouldShrinkRemainder() {
        AllocationId id = service.createAllocation(new CreateAllocationCommand(Accounts.ADMIN, Accounts.ALICE, amount(100))).result();

        assertTrue(service.reduceAllocation(Accounts.ADMIN, id, amount(40)).result());
        assertEquals(amount(60), service.getAllocation(id).result().getAmount());

        assertEquals(LedgerErrorCode.INVALID_AMOUNT, codeOf(service.reduceAllocation(Accounts.ADMIN, id, amount(61))));
        assertEquals(LedgerErrorCode.INVALID_AMOUNT, codeOf(service.reduceAllocation(Accounts.ADMIN, id, BigInteger.ZERO)));
        assertEquals(LedgerErrorCode.NOT_AUTHORIZED, codeOf(service.reduceAllocation(Accounts.STRANGER, id, amount(1))));
        assertEquals(amount(60), service.getAllocation(id).result().getAmount());

        service.revokeAllocation(Accounts.ADMIN, id);
        assertEquals(LedgerErrorCode.ALLOCATION_ALREADY_REVOKED, codeOf(service.reduceAllocation(Accounts.ADMIN, id, amount(1))));
    }

    @Test
    void executeAirdrop_shouldMintAndRecordEveryEntry() {
        Future<Long> result = service.executeAirdrop(new AirdropCommand(Accounts.ADMIN,
                List.of(Accounts.ALICE, Accounts.BOB), List.of(amount(10), amount(20))));

        assertTrue(result.succeeded());
        assertEquals(1L, result.result());
        verify(tokenLedger).mint(Accounts.ALICE, amount(10));
        verify(tokenLedger).mint(Accounts.BOB, amount(20));
        assertEquals(amount(20), service.getAllocation(AllocationId.of(2)).result().getAmount());

        ArgumentCaptor<LedgerEvent> events = ArgumentCaptor.forClass(LedgerEvent.class);
        verify(eventPublisher, atLeastOnce()).publish(events.capture());
        LedgerEvent airdrop = events.getAllValues().stream()
                .filter(event -> event.getType() == LedgerEventType.AIRDROP_EXECUTED)
                .findFirst()
                .orElseThrow();
        assertEquals(amount(30), airdrop.getAmount());
        assertEquals("2", airdrop.attribute("count"));
    }

    @Test
    void executeAirdrop_shouldValidateWholeBatchBeforeMinting() {
        assertEquals(LedgerErrorCode.EMPTY_BENEFICIARIES_LIST, codeOf(service.executeAirdrop(
                new AirdropCommand(Accounts.ADMIN, List.of(), List.of()))));
        assertEquals(LedgerErrorCode.ARRAYS_LENGTH_MISMATCH, codeOf(service.executeAirdrop(
                new AirdropCommand(Accounts.ADMIN, List.of(Accounts.ALICE, Accounts.BOB), List.of(amount(1))))));
        assertEquals(LedgerErrorCode.INVALID_AMOUNT, codeOf(service.executeAirdrop(
                new AirdropCommand(Accounts.ADMIN, List.of(Accounts.ALICE, Accounts.BOB), List.of(amount(1), BigInteger.ZERO)))));
        assertEquals(LedgerErrorCode.INVALID_BENEFICIARY, codeOf(service.executeAirdrop(
                new AirdropCommand(Accounts.ADMIN, List.of(Accounts.ALICE, Address.ZERO), List.of(amount(1), amount(1))))));

        verify(tokenLedger, never()).mint(any(), any());
        assertEquals(0, repository.count());
    }

    @Test
    void executeAirdrop_shouldRefuseBatchOverRemainingSupplyBeforeMinting() {
        when(tokenLedger.remainingSupply()).thenReturn(amount(25));

        Future<Long> result = service.executeAirdrop(new AirdropCommand(Accounts.ADMIN,
                List.of(Accounts.ALICE, Accounts.BOB), List.of(amount(10), amount(20))));

        assertEquals(LedgerErrorCode.MAX_SUPPLY_EXCEEDED, codeOf(result));
        verify(tokenLedger, never()).mint(any(), any());
        assertEquals(0, repository.count());
    }

    @Test
    void executeAirdrop_shouldLeaveBalancesUntouchedWhenSupplyCapWouldBeCrossed() {
        InMemoryTokenLedgerAdapter cappedLedger = new InMemoryTokenLedgerAdapter(amount(1500));
        LedgerGate gate = new LedgerGate("allocation");
        gate.grantRole(Role.ADMIN, Accounts.ADMIN);
        AllocationLedgerService capped = new AllocationLedgerService(new InMemoryAllocationPersistenceAdapter(),
                cappedLedger, eventPublisher, gate, new MutableClock(1_700_000_000L));

        Future<Long> result = capped.executeAirdrop(new AirdropCommand(Accounts.ADMIN,
                List.of(Accounts.ALICE, Accounts.BOB), List.of(amount(1000), amount(1000))));

        assertEquals(LedgerErrorCode.MAX_SUPPLY_EXCEEDED, codeOf(result));
        assertEquals(BigInteger.ZERO, cappedLedger.balanceOf(Accounts.ALICE));
        assertEquals(BigInteger.ZERO, cappedLedger.balanceOf(Accounts.BOB));
        assertEquals(BigInteger.ZERO, cappedLedger.getTotalSupply());
        assertTrue(capped.getAllocationsForBeneficiary(Accounts.ALICE).result().isEmpty());

        // The same batch fits once it is within the cap
        assertTrue(capped.executeAirdrop(new AirdropCommand(Accounts.ADMIN,
                List.of(Accounts.ALICE, Accounts.BOB), List.of(amount(1000), amount(500)))).succeeded());
        assertEquals(BigInteger.ZERO, cappedLedger.remainingSupply());
    }

    @Test
    void executeAirdrop_shouldRecordConsumedAllocations() {
        service.executeAirdrop(new AirdropCommand(Accounts.ADMIN, List.of(Accounts.ALICE), List.of(amount(40))));

        Allocation airdropped = service.getAllocation(AllocationId.of(1)).result();
        assertTrue(airdropped.isConsumed());
        assertFalse(airdropped.isRevoked());
        assertEquals(amount(40), airdropped.getAmount());
        assertEquals(LedgerErrorCode.ALLOCATION_CONSUMED,
                codeOf(service.reduceAllocation(Accounts.ADMIN, AllocationId.of(1), amount(1))));
        assertEquals(amount(40), service.getAllocation(AllocationId.of(1)).result().getAmount());
    }

    @Test
    void managers_shouldGuardSelfChangesAndDeduplicate() {
        assertTrue(service.addManager(Accounts.ADMIN, Accounts.MANAGER).succeeded());
        assertTrue(service.addManager(Accounts.ADMIN, Accounts.MANAGER).succeeded());
        assertEquals(List.of(Accounts.MANAGER), service.getAllManagers().result());

        assertEquals(LedgerErrorCode.CANNOT_ADD_SELF, codeOf(service.addManager(Accounts.ADMIN, Accounts.ADMIN)));
        assertEquals(LedgerErrorCode.CANNOT_REMOVE_SELF, codeOf(service.removeManager(Accounts.MANAGER, Accounts.MANAGER)));
        assertEquals(LedgerErrorCode.INVALID_ADDRESS, codeOf(service.addManager(Accounts.ADMIN, Address.ZERO)));
        assertEquals(LedgerErrorCode.NOT_AUTHORIZED, codeOf(service.addManager(Accounts.STRANGER, Accounts.BOB)));

        assertTrue(service.isManager(Accounts.MANAGER).result());
        assertTrue(service.isManager(Accounts.ADMIN).result());
        assertFalse(service.isManager(Accounts.STRANGER).result());

        assertTrue(service.removeManager(Accounts.ADMIN, Accounts.MANAGER).succeeded());
        assertFalse(service.isManager(Accounts.MANAGER).result());
        assertTrue(service.getAllManagers().result().isEmpty());
    }

    @Test
    void pause_shouldHaltMutationsButNotReads() {
        AllocationId id = service.createAllocation(new CreateAllocationCommand(Accounts.ADMIN, Accounts.ALICE, amount(100))).result();

        assertEquals(LedgerErrorCode.NOT_AUTHORIZED, codeOf(service.pause(Accounts.STRANGER)));
        assertTrue(service.pause(Accounts.ADMIN).succeeded());
        assertTrue(service.isPaused().result());

        assertEquals(LedgerErrorCode.ENFORCED_PAUSE, codeOf(service.createAllocation(
                new CreateAllocationCommand(Accounts.ADMIN, Accounts.ALICE, amount(1)))));
        assertEquals(LedgerErrorCode.ENFORCED_PAUSE, codeOf(service.reduceAllocation(Accounts.ADMIN, id, amount(1))));
        assertEquals(LedgerErrorCode.ENFORCED_PAUSE, codeOf(service.addManager(Accounts.ADMIN, Accounts.MANAGER)));
        assertTrue(service.getAllocation(id).succeeded());

        assertTrue(service.unpause(Accounts.ADMIN).succeeded());
        assertEquals(LedgerErrorCode.EXPECTED_PAUSE, codeOf(service.unpause(Accounts.ADMIN)));
        assertTrue(service.reduceAllocation(Accounts.ADMIN, id, amount(1)).succeeded());
    }

    @Test
    void getAllocation_shouldReturnDetachedCopy() {
        AllocationId id = service.createAllocation(new CreateAllocationCommand(Accounts.ADMIN, Accounts.ALICE, amount(100))).result();

        Allocation copy = service.getAllocation(id).result();
        copy.reduce(amount(50));

        assertEquals(amount(100), service.getAllocation(id).result().getAmount());
        assertEquals(LedgerErrorCode.INVALID_ALLOCATION_ID, codeOf(service.getAllocation(AllocationId.of(9))));
    }
}

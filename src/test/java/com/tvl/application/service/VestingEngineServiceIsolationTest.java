package com.tvl.application.service;

import com.tvl.adapter.out.persistence.InMemoryVestingSchedulePersistenceAdapter;
import com.tvl.application.port.in.VestingUseCase.CreateVestingScheduleCommand;
import com.tvl.application.port.out.AllocationLedger;
import com.tvl.application.port.out.LedgerEventPublisher;
import com.tvl.application.port.out.ManagerRegistry;
import com.tvl.application.port.out.TokenLedger;
import com.tvl.domain.event.LedgerEvent;
import com.tvl.domain.event.LedgerEventType;
import com.tvl.domain.exception.LedgerErrorCode;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Allocation;
import com.tvl.domain.model.AllocationId;
import com.tvl.domain.model.Role;
import com.tvl.domain.model.ScheduleId;
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
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit test for VestingEngineService
 * Tests the engine in isolation using mocks for the allocation ledger and the token ledger
 */
class VestingEngineServiceIsolationTest {

    private static final long T0 = 1_700_000_000L;
    private static final AllocationId ALLOCATION = AllocationId.of(3);

    @Mock
    private AllocationLedger allocationLedger;

    @Mock
    private ManagerRegistry managerRegistry;

    @Mock
    private TokenLedger tokenLedger;

    @Mock
    private LedgerEventPublisher eventPublisher;

    private MutableClock clock;
    private VestingEngineService engine;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        clock = new MutableClock(T0);
        LedgerGate gate = new LedgerGate("vesting");
        gate.grantRole(Role.ADMIN, Accounts.ADMIN);
        engine = new VestingEngineService(
                new InMemoryVestingSchedulePersistenceAdapter(),
                allocationLedger,
                managerRegistry,
                tokenLedger,
                eventPublisher,
                gate,
                clock,
                Accounts.ENGINE
        );
        when(allocationLedger.findAllocation(ALLOCATION))
                .thenReturn(Optional.of(new Allocation(ALLOCATION, Accounts.ALICE, BigInteger.valueOf(1000), T0)));
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private ScheduleId createLinkedSchedule() {
        Future<ScheduleId> result = engine.createVestingSchedule(new CreateVestingScheduleCommand(
                Accounts.ADMIN, Accounts.ALICE, BigInteger.valueOf(1000), T0, 0, 100, ALLOCATION));
        assertTrue(result.succeeded());
        return result.result();
    }

    @Test
    void claim_shouldReduceAllocationUnderEngineIdentity() {
        ScheduleId id = createLinkedSchedule();
        clock.setSeconds(T0 + 10);

        Future<BigInteger> result = engine.claimVestedTokens(Accounts.ALICE, id);

        assertEquals(BigInteger.valueOf(100), result.result());
        verify(tokenLedger).mint(Accounts.ALICE, BigInteger.valueOf(100));
        verify(allocationLedger).reduceAllocation(Accounts.ENGINE, ALLOCATION, BigInteger.valueOf(100));
    }

    @Test
    void claim_shouldSwallowReductionFailureAndPublishSkip() {
        ScheduleId id = createLinkedSchedule();
        doThrow(new LedgerException(LedgerErrorCode.NOT_AUTHORIZED))
                .when(allocationLedger).reduceAllocation(any(), any(), any());
        clock.setSeconds(T0 + 10);

        Future<BigInteger> result = engine.claimVestedTokens(Accounts.ALICE, id);

        assertTrue(result.succeeded());
        assertEquals(BigInteger.valueOf(100), engine.getVestingSchedule(id).result().getReleasedAmount());

        ArgumentCaptor<LedgerEvent> events = ArgumentCaptor.forClass(LedgerEvent.class);
        verify(eventPublisher, atLeastOnce()).publish(events.capture());
        LedgerEvent skipped = events.getAllValues().stream()
                .filter(event -> event.getType() == LedgerEventType.ALLOCATION_REDUCTION_SKIPPED)
                .findFirst()
                .orElseThrow();
        assertEquals("NOT_AUTHORIZED", skipped.attribute("reason"));
        assertEquals(ALLOCATION.toString(), skipped.attribute("allocationId"));
    }

    @Test
    void claim_shouldChangeNothingWhenMintFails() {
        ScheduleId id = createLinkedSchedule();
        doThrow(new LedgerException(LedgerErrorCode.MAX_SUPPLY_EXCEEDED))
                .when(tokenLedger).mint(any(), any());
        clock.setSeconds(T0 + 50);

        Future<BigInteger> result = engine.claimVestedTokens(Accounts.ALICE, id);

        assertTrue(result.failed());
        assertEquals(LedgerErrorCode.MAX_SUPPLY_EXCEEDED, ((LedgerException) result.cause()).getCode());
        assertEquals(BigInteger.ZERO, engine.getVestingSchedule(id).result().getReleasedAmount());
        assertEquals(BigInteger.ZERO, engine.getTotals().result().getTotalClaimed());
        verify(allocationLedger, never()).reduceAllocation(any(), any(), any());
    }

    @Test
    void claim_shouldRejectReentryFromMintCallback() {
        ScheduleId id = createLinkedSchedule();
        clock.setSeconds(T0 + 50);
        AtomicReference<Future<BigInteger>> nested = new AtomicReference<>();
        doAnswer(invocation -> {
            nested.set(engine.claimVestedTokens(Accounts.ALICE, id));
            return null;
        }).when(tokenLedger).mint(eq(Accounts.ALICE), any());

        Future<BigInteger> outer = engine.claimVestedTokens(Accounts.ALICE, id);

        assertEquals(BigInteger.valueOf(500), outer.result());
        assertTrue(nested.get().failed());
        assertEquals(LedgerErrorCode.REENTRANT_CALL, ((LedgerException) nested.get().cause()).getCode());
        verify(tokenLedger, times(1)).mint(any(), any());
        assertEquals(BigInteger.valueOf(500), engine.getVestingSchedule(id).result().getReleasedAmount());
    }

    @Test
    void revoke_shouldKeepScheduleWhenAllocationLedgerRefuses() {
        ScheduleId id = createLinkedSchedule();
        doThrow(new LedgerException(LedgerErrorCode.ENFORCED_PAUSE))
                .when(allocationLedger).revokeAllocation(Accounts.ENGINE, ALLOCATION);

        Future<BigInteger> result = engine.revokeSchedule(Accounts.ADMIN, id);

        assertEquals(LedgerErrorCode.ENFORCED_PAUSE, ((LedgerException) result.cause()).getCode());
        assertFalse(engine.getVestingSchedule(id).result().isRevoked());
        assertEquals(BigInteger.valueOf(1000), engine.getTotals().result().getTotalVested());
    }

    @Test
    void manager_shouldBePrivileged() {
        when(managerRegistry.isManager(Accounts.MANAGER)).thenReturn(true);

        Future<ScheduleId> result = engine.createVestingSchedule(new CreateVestingScheduleCommand(
                Accounts.MANAGER, Accounts.BOB, BigInteger.TEN, T0, 0, 10, AllocationId.NONE));

        assertTrue(result.succeeded());
        verify(allocationLedger, never()).findAllocation(any());
    }
}

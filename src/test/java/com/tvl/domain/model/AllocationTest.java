package com.tvl.domain.model;

import com.tvl.support.Accounts;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Allocation entity
 */
class AllocationTest {

    private Allocation allocation(long amount) {
        return new Allocation(AllocationId.of(1), Accounts.ALICE, BigInteger.valueOf(amount), 100L);
    }

    @Test
    void testAllocationCreation() {
        Allocation allocation = allocation(500);

        assertEquals(AllocationId.of(1), allocation.getId());
        assertEquals(Accounts.ALICE, allocation.getBeneficiary());
        assertEquals(BigInteger.valueOf(500), allocation.getAmount());
        assertEquals(100L, allocation.getCreatedAt());
        assertFalse(allocation.isRevoked());
        assertFalse(allocation.isConsumed());
        assertTrue(allocation.belongsTo(Accounts.ALICE));
        assertFalse(allocation.belongsTo(Accounts.BOB));
    }

    @Test
    void testRejectsNonPositiveAmountAndUnassignedId() {
        assertThrows(IllegalArgumentException.class, () -> allocation(0));
        assertThrows(IllegalArgumentException.class,
                () -> new Allocation(AllocationId.NONE, Accounts.ALICE, BigInteger.TEN, 0L));
    }

    @Test
    void testReduce() {
        Allocation allocation = allocation(500);

        allocation.reduce(BigInteger.valueOf(200));
        assertEquals(BigInteger.valueOf(300), allocation.getAmount());

        allocation.reduce(BigInteger.valueOf(300));
        assertEquals(BigInteger.ZERO, allocation.getAmount());
        assertFalse(allocation.canReduceBy(BigInteger.ONE));
    }

    @Test
    void testCannotReduceBeyondRemainderOrAfterRevoke() {
        Allocation allocation = allocation(500);

        assertThrows(IllegalStateException.class, () -> allocation.reduce(BigInteger.valueOf(501)));
        assertThrows(IllegalStateException.class, () -> allocation.reduce(BigInteger.ZERO));

        allocation.revoke();
        assertTrue(allocation.isRevoked());
        assertFalse(allocation.canReduceBy(BigInteger.ONE));
        assertThrows(IllegalStateException.class, allocation::revoke);
    }

    @Test
    void testSnapshotIsDetached() {
        Allocation allocation = allocation(500);
        Allocation snapshot = allocation.snapshot();

        allocation.reduce(BigInteger.valueOf(100));
        allocation.revoke();

        assertEquals(BigInteger.valueOf(500), snapshot.getAmount());
        assertFalse(snapshot.isRevoked());
        assertEquals(allocation, snapshot);
    }

    @Test
    void testAirdroppedAllocationIsConsumed() {
        Allocation airdropped = Allocation.airdropped(AllocationId.of(2), Accounts.BOB, BigInteger.valueOf(70), 100L);

        assertTrue(airdropped.isConsumed());
        assertEquals(BigInteger.valueOf(70), airdropped.getAmount());
        assertFalse(airdropped.canReduceBy(BigInteger.ONE));
        assertThrows(IllegalStateException.class, () -> airdropped.reduce(BigInteger.ONE));
        assertTrue(airdropped.snapshot().isConsumed());
        assertThrows(IllegalArgumentException.class,
                () -> Allocation.airdropped(AllocationId.of(3), Accounts.BOB, BigInteger.ZERO, 100L));
    }
}

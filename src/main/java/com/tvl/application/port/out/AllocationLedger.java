package com.tvl.application.port.out;

import com.tvl.domain.model.Address;
import com.tvl.domain.model.Allocation;
import com.tvl.domain.model.AllocationId;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Output port through which the vesting engine reaches the allocation ledger.
 * Calls are synchronous and run inside the engine's own guarded operation.
 */
public interface AllocationLedger {

    /**
     * Read-only copy of the allocation, empty when the id is out of range.
     */
    Optional<Allocation> findAllocation(AllocationId allocationId);

    /**
     * @throws com.tvl.domain.exception.LedgerException when the allocation ledger rejects the call
     */
    void reduceAllocation(Address caller, AllocationId allocationId, BigInteger amount);

    /**
     * @throws com.tvl.domain.exception.LedgerException when the allocation ledger rejects the call
     */
    void revokeAllocation(Address caller, AllocationId allocationId);
}

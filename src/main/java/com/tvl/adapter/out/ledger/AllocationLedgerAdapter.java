package com.tvl.adapter.out.ledger;

import com.tvl.application.port.in.AllocationQueryUseCase;
import com.tvl.application.port.in.AllocationUseCase;
import com.tvl.application.port.out.AllocationLedger;
import com.tvl.domain.exception.LedgerErrorCode;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.Allocation;
import com.tvl.domain.model.AllocationId;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Connects the vesting engine to the in-process allocation ledger
 */
@RequiredArgsConstructor
public class AllocationLedgerAdapter implements AllocationLedger {

    private final AllocationUseCase allocationUseCase;
    private final AllocationQueryUseCase allocationQueryUseCase;

    @Override
    public Optional<Allocation> findAllocation(AllocationId allocationId) {
        try {
            return Optional.of(CompletedFutures.await(allocationQueryUseCase.getAllocation(allocationId)));
        } catch (LedgerException e) {
            if (e.is(LedgerErrorCode.INVALID_ALLOCATION_ID)) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public void reduceAllocation(Address caller, AllocationId allocationId, BigInteger amount) {
        CompletedFutures.await(allocationUseCase.reduceAllocation(caller, allocationId, amount));
    }

    @Override
    public void revokeAllocation(Address caller, AllocationId allocationId) {
        CompletedFutures.await(allocationUseCase.revokeAllocation(caller, allocationId));
    }
}

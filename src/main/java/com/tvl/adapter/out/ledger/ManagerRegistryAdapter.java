package com.tvl.adapter.out.ledger;

import com.tvl.application.port.in.AllocationQueryUseCase;
import com.tvl.application.port.out.ManagerRegistry;
import com.tvl.domain.model.Address;
import lombok.RequiredArgsConstructor;

/**
 * Manager registry backed by the allocation ledger, so one manager list governs both ledgers
 */
@RequiredArgsConstructor
public class ManagerRegistryAdapter implements ManagerRegistry {

    private final AllocationQueryUseCase allocationQueryUseCase;

    @Override
    public boolean isManager(Address account) {
        return Boolean.TRUE.equals(CompletedFutures.await(allocationQueryUseCase.isManager(account)));
    }
}

package com.tvl.adapter.out.persistence;

import com.tvl.application.port.out.AllocationRepository;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.Allocation;
import com.tvl.domain.model.AllocationId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory allocation table.
 * Index i of the table holds allocation id i + 1; rows are never removed.
 * Callers serialize access through the ledger gate.
 */
public class InMemoryAllocationPersistenceAdapter implements AllocationRepository {

    private final List<Allocation> table = new ArrayList<>();
    private final Map<Address, List<AllocationId>> byBeneficiary = new HashMap<>();

    @Override
    public AllocationId nextId() {
        return AllocationId.of(table.size() + 1L);
    }

    @Override
    public void save(Allocation allocation) {
        if (!allocation.getId().equals(nextId())) {
            throw new IllegalStateException("Expected allocation id " + nextId() + " but got " + allocation.getId());
        }
        table.add(allocation);
        byBeneficiary.computeIfAbsent(allocation.getBeneficiary(), b -> new ArrayList<>()).add(allocation.getId());
    }

    @Override
    public Optional<Allocation> findById(AllocationId id) {
        if (id == null || id.isNone() || id.value() > table.size()) {
            return Optional.empty();
        }
        return Optional.of(table.get((int) (id.value() - 1)));
    }

    @Override
    public List<AllocationId> findIdsByBeneficiary(Address beneficiary) {
        List<AllocationId> ids = byBeneficiary.get(beneficiary);
        return ids == null ? Collections.emptyList() : Collections.unmodifiableList(ids);
    }

    @Override
    public long count() {
        return table.size();
    }
}

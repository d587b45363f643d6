package com.tvl.application.port.out;

import com.tvl.domain.model.Address;
import com.tvl.domain.model.Allocation;
import com.tvl.domain.model.AllocationId;

import java.util.List;
import java.util.Optional;

/**
 * Output port for allocation storage.
 * Append-only table keyed by sequential id plus a beneficiary index.
 */
public interface AllocationRepository {

    /**
     * Id the next saved allocation must carry.
     */
    AllocationId nextId();

    /**
     * Append a new allocation; its id must equal {@link #nextId()}.
     */
    void save(Allocation allocation);

    Optional<Allocation> findById(AllocationId id);

    List<AllocationId> findIdsByBeneficiary(Address beneficiary);

    long count();
}

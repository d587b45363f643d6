package com.tvl.application.port.in;

import com.tvl.domain.model.Address;
import com.tvl.domain.model.Allocation;
import com.tvl.domain.model.AllocationId;
import io.vertx.core.Future;

import java.util.List;

/**
 * Input port for reading the allocation ledger. Reads are available while paused.
 */
public interface AllocationQueryUseCase {

    /**
     * @return Future with a detached copy, failed with INVALID_ALLOCATION_ID when unknown
     */
    Future<Allocation> getAllocation(AllocationId allocationId);

    Future<List<AllocationId>> getAllocationsForBeneficiary(Address beneficiary);

    /**
     * True for registered managers and for admins.
     */
    Future<Boolean> isManager(Address account);

    Future<List<Address>> getAllManagers();

    Future<Boolean> isPaused();
}

package com.tvl.application.port.in;

import com.tvl.domain.model.Address;
import com.tvl.domain.model.AllocationId;
import io.vertx.core.Future;

import java.math.BigInteger;
import java.util.List;

/**
 * Input port for the allocation ledger.
 * Every operation either applies completely or fails with a
 * {@link com.tvl.domain.exception.LedgerException} and changes nothing.
 */
public interface AllocationUseCase {

    /**
     * Reserve tokens for a beneficiary. No tokens move.
     * @return Future with the new allocation id
     */
    Future<AllocationId> createAllocation(CreateAllocationCommand command);

    Future<Boolean> revokeAllocation(Address caller, AllocationId allocationId);

    /**
     * Shrink an allocation by what has been minted against it.
     */
    Future<Boolean> reduceAllocation(Address caller, AllocationId allocationId, BigInteger amount);

    /**
     * Allocate and mint to every beneficiary at once.
     * @return Future with the airdrop id
     */
    Future<Long> executeAirdrop(AirdropCommand command);

    Future<Void> addManager(Address caller, Address manager);

    Future<Void> removeManager(Address caller, Address manager);

    Future<Void> pause(Address caller);

    Future<Void> unpause(Address caller);

    record CreateAllocationCommand(
            Address caller,
            Address beneficiary,
            BigInteger amount
    ) {}

    record AirdropCommand(
            Address caller,
            List<Address> beneficiaries,
            List<BigInteger> amounts
    ) {}
}

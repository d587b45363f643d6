package com.tvl.application.port.out;

import com.tvl.domain.model.Address;

/**
 * Output port answering whether an address is a registered manager.
 * The registry is hosted by the allocation ledger and shared with the vesting engine.
 */
@FunctionalInterface
public interface ManagerRegistry {

    boolean isManager(Address account);
}

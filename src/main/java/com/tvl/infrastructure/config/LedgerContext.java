package com.tvl.infrastructure.config;

import com.tvl.adapter.out.ledger.AllocationLedgerAdapter;
import com.tvl.adapter.out.ledger.InMemoryTokenLedgerAdapter;
import com.tvl.adapter.out.ledger.ManagerRegistryAdapter;
import com.tvl.adapter.out.persistence.InMemoryAllocationPersistenceAdapter;
import com.tvl.adapter.out.persistence.InMemoryVestingSchedulePersistenceAdapter;
import com.tvl.application.port.out.LedgerEventPublisher;
import com.tvl.application.port.out.TokenLedger;
import com.tvl.application.service.AllocationLedgerService;
import com.tvl.application.service.LedgerGate;
import com.tvl.application.service.VestingEngineService;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.Role;
import io.vertx.core.Future;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Wires the allocation ledger, the vesting engine and their adapters, and applies the
 * configured role and manager grants.
 */
@Slf4j
@Getter
public class LedgerContext {

    private final LedgerConfig config;
    private final TokenLedger tokenLedger;
    private final AllocationLedgerService allocationLedger;
    private final VestingEngineService vestingEngine;

    private LedgerContext(LedgerConfig config, TokenLedger tokenLedger,
                          AllocationLedgerService allocationLedger, VestingEngineService vestingEngine) {
        this.config = config;
        this.tokenLedger = tokenLedger;
        this.allocationLedger = allocationLedger;
        this.vestingEngine = vestingEngine;
    }

    public static LedgerContext create(LedgerConfig config, LedgerEventPublisher eventPublisher, Clock clock) {
        return create(config, new InMemoryTokenLedgerAdapter(config.getMaxSupply()), eventPublisher, clock);
    }

    public static LedgerContext create(LedgerConfig config, TokenLedger tokenLedger,
                                       LedgerEventPublisher eventPublisher, Clock clock) {
        LedgerGate allocationGate = new LedgerGate("allocation");
        allocationGate.grantRole(Role.ADMIN, config.getAdmin());
        AllocationLedgerService allocationLedger = new AllocationLedgerService(
                new InMemoryAllocationPersistenceAdapter(),
                tokenLedger,
                eventPublisher,
                allocationGate,
                clock
        );

        LedgerGate vestingGate = new LedgerGate("vesting");
        vestingGate.grantRole(Role.ADMIN, config.getAdmin());
        for (Map.Entry<Role, List<Address>> grant : config.getVestingRoles().entrySet()) {
            grant.getValue().forEach(account -> vestingGate.grantRole(grant.getKey(), account));
        }
        VestingEngineService vestingEngine = new VestingEngineService(
                new InMemoryVestingSchedulePersistenceAdapter(),
                new AllocationLedgerAdapter(allocationLedger, allocationLedger),
                new ManagerRegistryAdapter(allocationLedger),
                tokenLedger,
                eventPublisher,
                vestingGate,
                clock,
                config.getVestingEngine()
        );

        // The engine reduces and revokes allocations under its own address
        registerManager(allocationLedger, config.getAdmin(), config.getVestingEngine());
        config.getManagers().forEach(manager -> registerManager(allocationLedger, config.getAdmin(), manager));

        log.info("Ledgers wired: admin {}, vesting engine {}, {} managers",
                config.getAdmin(), config.getVestingEngine(), config.getManagers().size());
        return new LedgerContext(config, tokenLedger, allocationLedger, vestingEngine);
    }

    private static void registerManager(AllocationLedgerService allocationLedger, Address admin, Address manager) {
        if (manager.equals(admin)) {
            return;
        }
        Future<Void> registration = allocationLedger.addManager(admin, manager);
        if (registration.failed()) {
            throw new IllegalStateException("Cannot register manager " + manager, registration.cause());
        }
    }
}

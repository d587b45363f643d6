package com.tvl.application.service;

import com.tvl.domain.exception.LedgerErrorCode;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import com.tvl.domain.model.Role;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Access and pause gate of one ledger instance.
 *
 * <p>Holds the role table and the pause flag, and serializes every operation on the ledger
 * through a single lock. A mutating operation entered again from the thread that already
 * runs one (for example from a token ledger callback) is rejected with REENTRANT_CALL.</p>
 */
@Slf4j
public class LedgerGate {

    private final String ledgerName;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Map<Role, Set<Address>> roles = new EnumMap<>(Role.class);
    private boolean paused;
    private boolean mutating;

    public LedgerGate(String ledgerName) {
        this.ledgerName = ledgerName;
    }

    /**
     * Run a mutating operation as one atomic unit and report the outcome as a completed future.
     */
    public <T> Future<T> submit(String operation, Supplier<T> action) {
        try {
            return Future.succeededFuture(execute(operation, action));
        } catch (LedgerException e) {
            log.warn("{} ledger rejected {}: {} ({})", ledgerName, operation, e.getCode(), e.getMessage());
            return Future.failedFuture(e);
        } catch (RuntimeException e) {
            log.error("{} ledger failed on {}", ledgerName, operation, e);
            return Future.failedFuture(e);
        }
    }

    /**
     * Run a read under the ledger lock. Reads are allowed while paused and from inside an operation.
     */
    public <T> Future<T> query(Supplier<T> read) {
        lock.lock();
        try {
            return Future.succeededFuture(read.get());
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a mutating operation under the ledger lock, rejecting reentrant entry.
     */
    public <T> T execute(String operation, Supplier<T> action) {
        lock.lock();
        try {
            if (mutating) {
                throw new LedgerException(LedgerErrorCode.REENTRANT_CALL,
                        "Reentrant call to " + operation + " on " + ledgerName + " ledger");
            }
            mutating = true;
            try {
                return action.get();
            } finally {
                mutating = false;
            }
        } finally {
            lock.unlock();
        }
    }

    public void requireNotPaused() {
        if (paused) {
            throw new LedgerException(LedgerErrorCode.ENFORCED_PAUSE, ledgerName + " ledger is paused");
        }
    }

    public void requireRole(Address caller, Role role) {
        if (!hasRole(role, caller)) {
            throw new LedgerException(LedgerErrorCode.NOT_AUTHORIZED,
                    caller + " lacks role " + role.getValue() + " on " + ledgerName + " ledger");
        }
    }

    public boolean hasRole(Role role, Address account) {
        Set<Address> holders = roles.get(role);
        return account != null && holders != null && holders.contains(account);
    }

    public boolean hasAnyRole(Address account, Role... candidates) {
        for (Role role : candidates) {
            if (hasRole(role, account)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true when the account did not hold the role before
     */
    public boolean grantRole(Role role, Address account) {
        if (account == null || account.isZero()) {
            throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS, "Cannot grant " + role + " to the zero address");
        }
        return roles.computeIfAbsent(role, r -> new LinkedHashSet<>()).add(account);
    }

    /**
     * @return true when the account held the role
     */
    public boolean revokeRole(Role role, Address account) {
        Set<Address> holders = roles.get(role);
        return holders != null && holders.remove(account);
    }

    public boolean isPaused() {
        return paused;
    }

    public void pause() {
        if (paused) {
            throw new LedgerException(LedgerErrorCode.ENFORCED_PAUSE, ledgerName + " ledger is already paused");
        }
        paused = true;
        log.info("{} ledger paused", ledgerName);
    }

    public void unpause() {
        if (!paused) {
            throw new LedgerException(LedgerErrorCode.EXPECTED_PAUSE, ledgerName + " ledger is not paused");
        }
        paused = false;
        log.info("{} ledger unpaused", ledgerName);
    }
}

package com.tvl.adapter.out.ledger;

import com.tvl.application.port.out.TokenLedger;
import com.tvl.domain.exception.LedgerErrorCode;
import com.tvl.domain.exception.LedgerException;
import com.tvl.domain.model.Address;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory token ledger with a capped supply.
 * Stands in for the real token where none is attached.
 */
@Slf4j
public class InMemoryTokenLedgerAdapter implements TokenLedger {

    private final BigInteger maxSupply;
    private final Map<Address, BigInteger> balances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryTokenLedgerAdapter(BigInteger maxSupply) {
        if (maxSupply == null || maxSupply.signum() <= 0) {
            throw new IllegalArgumentException("Max supply must be positive");
        }
        this.maxSupply = maxSupply;
    }

    @Override
    public synchronized void mint(Address beneficiary, BigInteger amount) {
        if (beneficiary == null || beneficiary.isZero()) {
            throw new LedgerException(LedgerErrorCode.INVALID_ADDRESS, "Cannot mint to the zero address");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "Mint amount must be greater than zero");
        }
        BigInteger newSupply = totalSupply.add(amount);
        if (newSupply.compareTo(maxSupply) > 0) {
            throw new LedgerException(LedgerErrorCode.MAX_SUPPLY_EXCEEDED,
                    "Minting " + amount + " would raise supply to " + newSupply + " over " + maxSupply);
        }
        balances.merge(beneficiary, amount, BigInteger::add);
        totalSupply = newSupply;
        log.debug("Minted {} to {}, supply {}", amount, beneficiary, totalSupply);
    }

    @Override
    public synchronized BigInteger balanceOf(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger remainingSupply() {
        return maxSupply.subtract(totalSupply);
    }

    public synchronized BigInteger getTotalSupply() {
        return totalSupply;
    }
}

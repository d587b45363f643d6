package com.tvl.application.port.out;

import com.tvl.domain.model.Address;

import java.math.BigInteger;

/**
 * Output port for the external token ledger.
 * The ledgers only mint into it; balances are exposed for inspection, never for decisions.
 * The remaining supply lets a batch be refused before its first mint.
 */
public interface TokenLedger {

    /**
     * Mint {@code amount} to {@code beneficiary}.
     * @throws com.tvl.domain.exception.LedgerException when the token ledger refuses the mint
     */
    void mint(Address beneficiary, BigInteger amount);

    BigInteger balanceOf(Address account);

    /**
     * Amount that can still be minted before the supply cap is reached.
     */
    BigInteger remainingSupply();
}

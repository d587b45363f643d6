package com.tvl.domain.event;

import com.tvl.domain.model.Address;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Domain event raised after a ledger operation has been applied.
 * {@code referenceId} is the allocation, schedule or airdrop id the event is about (0 when none).
 */
@Value
@Builder
public class LedgerEvent {
    LedgerEventType type;
    String ledger;           // "allocation" or "vesting"
    long referenceId;
    Address account;
    BigInteger amount;
    long occurredAt;         // Epoch seconds
    @Singular
    Map<String, String> attributes;

    public String attribute(String name) {
        return attributes.get(name);
    }
}

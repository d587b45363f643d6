package com.tvl.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * Allocation entity - tokens reserved for one beneficiary.
 * The remaining amount only ever goes down; records are never deleted.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "id")
public class Allocation {
    private final AllocationId id;
    private final Address beneficiary;
    private final long createdAt;        // Epoch seconds
    private BigInteger amount;           // Remaining, smallest token unit
    private final boolean consumed;      // Minted at creation, cannot back a schedule
    private boolean revoked;

    public Allocation(AllocationId id, Address beneficiary, BigInteger amount, long createdAt) {
        this(id, beneficiary, amount, createdAt, false, false);
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Allocation amount must be positive");
        }
    }

    private Allocation(AllocationId id, Address beneficiary, BigInteger amount, long createdAt,
                       boolean consumed, boolean revoked) {
        if (id == null || id.isNone()) {
            throw new IllegalArgumentException("Allocation id must be assigned");
        }
        this.id = id;
        this.beneficiary = beneficiary;
        this.amount = amount;
        this.createdAt = createdAt;
        this.consumed = consumed;
        this.revoked = revoked;
    }

    /**
     * Record of an airdrop entry. The tokens are already minted, so the allocation keeps the
     * airdropped amount for reference but can neither be reduced nor back a vesting schedule.
     */
    public static Allocation airdropped(AllocationId id, Address beneficiary, BigInteger amount, long createdAt) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Allocation amount must be positive");
        }
        return new Allocation(id, beneficiary, amount, createdAt, true, false);
    }

    public boolean belongsTo(Address address) {
        return beneficiary.equals(address);
    }

    public boolean covers(BigInteger requested) {
        return amount.compareTo(requested) >= 0;
    }

    /**
     * True when the allocation is live, not consumed, and holds at least {@code requested}.
     */
    public boolean canReduceBy(BigInteger requested) {
        return !revoked && !consumed && requested.signum() > 0 && covers(requested);
    }

    public void reduce(BigInteger by) {
        if (!canReduceBy(by)) {
            throw new IllegalStateException("Allocation " + id + " cannot be reduced by " + by);
        }
        this.amount = amount.subtract(by);
    }

    public void revoke() {
        if (revoked) {
            throw new IllegalStateException("Allocation " + id + " is already revoked");
        }
        this.revoked = true;
    }

    /**
     * Detached copy handed out to readers.
     */
    public Allocation snapshot() {
        return new Allocation(id, beneficiary, amount, createdAt, consumed, revoked);
    }
}

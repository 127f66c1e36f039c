package com.lendingengine.store;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Pool-wide mutable state. A single row keyed by {@link #POOL_ID}.
 */
@Entity
@Table(name = "pool_state")
@Data
@NoArgsConstructor
public class PoolState {

    public static final String POOL_ID = "default";

    @Id
    private String poolId;

    /**
     * Base-asset liquidity available for new borrows and withdrawals.
     */
    @Column(name = "total_supplied", nullable = false)
    private long totalSupplied;

    @Column(name = "fee_recipient", nullable = false)
    private String feeRecipient;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public PoolState(String feeRecipient) {
        this.poolId = POOL_ID;
        this.feeRecipient = feeRecipient;
        this.updatedAt = Instant.now();
    }
}

package com.lendingengine.store;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Supply position of one lender.
 *
 * Created on first deposit and never deleted; the balance may return to zero.
 */
@Entity
@Table(name = "lender_records")
@Data
@NoArgsConstructor
public class LenderRecord {

    @Id
    private String account;

    @Column(name = "amount_supplied", nullable = false)
    private long amountSupplied;

    /**
     * Time of the most recent deposit.
     */
    @Column(name = "deposit_timestamp")
    private Instant depositTimestamp;

    @Version
    private Long version;

    public LenderRecord(String account) {
        this.account = account;
    }
}

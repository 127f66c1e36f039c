package com.lendingengine.store;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Credit position of one borrower.
 *
 * Principal fields return to zero when a loan is repaid in full or liquidated.
 * {@code initialBorrowAmount} and {@code amountRepaid} are lifetime totals and
 * persist across borrow cycles; the repayment-schedule liquidation rules compare
 * against them.
 */
@Entity
@Table(name = "borrower_records")
@Data
@NoArgsConstructor
public class BorrowerRecord {

    @Id
    private String account;

    /**
     * Outstanding principal.
     */
    @Column(name = "amount_borrowed", nullable = false)
    private long amountBorrowed;

    /**
     * Cumulative principal ever drawn. Never decreases.
     */
    @Column(name = "initial_borrow_amount", nullable = false)
    private long initialBorrowAmount;

    @Column(name = "collateral_deposited", nullable = false)
    private long collateralDeposited;

    /**
     * Start of the current loan, null when there is none.
     * A collateral deposit also stamps it.
     */
    @Column(name = "borrow_timestamp")
    private Instant borrowTimestamp;

    @Column(name = "last_iteration")
    private Instant lastIteration;

    /**
     * Cumulative principal repaid against {@code initialBorrowAmount}.
     */
    @Column(name = "amount_repaid", nullable = false)
    private long amountRepaid;

    @Version
    private Long version;

    public BorrowerRecord(String account) {
        this.account = account;
    }

    public boolean hasActiveLoan() {
        return amountBorrowed > 0;
    }

    public LoanState getLoanState() {
        return hasActiveLoan() ? LoanState.ACTIVE : LoanState.NO_LOAN;
    }
}

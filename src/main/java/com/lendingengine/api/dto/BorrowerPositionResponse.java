package com.lendingengine.api.dto;

import com.lendingengine.store.BorrowerRecord;
import com.lendingengine.store.LoanState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Full borrower record as exposed over the API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BorrowerPositionResponse {

    private String account;
    private LoanState loanState;
    private long amountBorrowed;
    private long initialBorrowAmount;
    private long collateralDeposited;
    private long amountRepaid;
    private Instant borrowTimestamp;
    private Instant lastIteration;

    public static BorrowerPositionResponse from(BorrowerRecord record) {
        return BorrowerPositionResponse.builder()
            .account(record.getAccount())
            .loanState(record.getLoanState())
            .amountBorrowed(record.getAmountBorrowed())
            .initialBorrowAmount(record.getInitialBorrowAmount())
            .collateralDeposited(record.getCollateralDeposited())
            .amountRepaid(record.getAmountRepaid())
            .borrowTimestamp(record.getBorrowTimestamp())
            .lastIteration(record.getLastIteration())
            .build();
    }
}

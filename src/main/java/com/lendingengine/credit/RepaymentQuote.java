package com.lendingengine.credit;

import lombok.Builder;
import lombok.Value;

/**
 * What a borrower owes at a given moment if they repaid everything.
 */
@Value
@Builder
public class RepaymentQuote {
    String borrower;
    LoanQuarter quarter;
    long principal;
    long interest;

    /**
     * Fee routed to the fee recipient out of the interest, charged on full closure only.
     */
    long feeOnClosure;

    long totalDebt;

    public static RepaymentQuote none(String borrower) {
        return RepaymentQuote.builder()
            .borrower(borrower)
            .build();
    }
}

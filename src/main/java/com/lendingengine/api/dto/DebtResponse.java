package com.lendingengine.api.dto;

import com.lendingengine.credit.LoanQuarter;
import com.lendingengine.credit.RepaymentQuote;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current debt of a borrower and the collateral ratio backing it.
 * A null quarter means there is no active loan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DebtResponse {

    private String account;
    private LoanQuarter quarter;
    private long principal;
    private long interest;
    private long feeOnClosure;
    private long totalDebt;
    private long collateralRatioBps;

    public static DebtResponse from(RepaymentQuote quote, long collateralRatioBps) {
        return DebtResponse.builder()
            .account(quote.getBorrower())
            .quarter(quote.getQuarter())
            .principal(quote.getPrincipal())
            .interest(quote.getInterest())
            .feeOnClosure(quote.getFeeOnClosure())
            .totalDebt(quote.getTotalDebt())
            .collateralRatioBps(collateralRatioBps)
            .build();
    }
}

package com.lendingengine.api.controller;

import com.lendingengine.api.dto.AmountRequest;
import com.lendingengine.api.dto.BorrowerPositionResponse;
import com.lendingengine.api.dto.DebtResponse;
import com.lendingengine.pool.LendingPool;
import com.lendingengine.store.BorrowerRecord;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for borrowers: collateral, borrowing and repayment.
 */
@RestController
@RequestMapping("/api/v1/borrowers")
@RequiredArgsConstructor
@Tag(name = "Borrowers", description = "Collateral, borrow and repay")
public class BorrowerController {

    private final LendingPool lendingPool;

    @PostMapping("/{account}/collateral")
    @Operation(summary = "Lock collateral")
    public ResponseEntity<BorrowerPositionResponse> depositCollateral(
            @PathVariable String account,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(BorrowerPositionResponse.from(
            lendingPool.depositCollateral(account, request.getAmount())));
    }

    @PostMapping("/{account}/collateral/withdraw")
    @Operation(summary = "Release collateral not backing debt")
    public ResponseEntity<BorrowerPositionResponse> withdrawCollateral(
            @PathVariable String account,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(BorrowerPositionResponse.from(
            lendingPool.withdrawCollateral(account, request.getAmount())));
    }

    @PostMapping("/{account}/borrow")
    @Operation(summary = "Borrow base asset against collateral")
    public ResponseEntity<BorrowerPositionResponse> borrow(
            @PathVariable String account,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(BorrowerPositionResponse.from(
            lendingPool.borrow(account, request.getAmount())));
    }

    @PostMapping("/{account}/repay")
    @Operation(summary = "Repay principal plus current-quarter interest")
    public ResponseEntity<BorrowerPositionResponse> repay(
            @PathVariable String account,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(BorrowerPositionResponse.from(
            lendingPool.repay(account, request.getAmount())));
    }

    @GetMapping("/{account}")
    @Operation(summary = "Get the full borrower record")
    public ResponseEntity<BorrowerPositionResponse> getBorrower(@PathVariable String account) {
        return ResponseEntity.ok(BorrowerPositionResponse.from(
            lendingPool.getBorrower(account).orElseGet(() -> new BorrowerRecord(account))));
    }

    @GetMapping("/{account}/debt")
    @Operation(summary = "Get total debt and collateral ratio")
    public ResponseEntity<DebtResponse> getDebt(@PathVariable String account) {
        return ResponseEntity.ok(DebtResponse.from(
            lendingPool.getRepaymentQuote(account),
            lendingPool.getCollateralRatio(account)));
    }
}

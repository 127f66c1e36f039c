package com.lendingengine.api.controller;

import com.lendingengine.api.dto.AmountRequest;
import com.lendingengine.api.dto.LenderPositionResponse;
import com.lendingengine.pool.LendingPool;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for lenders supplying the base asset.
 */
@RestController
@RequestMapping("/api/v1/lenders")
@RequiredArgsConstructor
@Tag(name = "Lenders", description = "Supply and withdraw the lendable asset")
public class LenderController {

    private final LendingPool lendingPool;

    @PostMapping("/{account}/deposit")
    @Operation(summary = "Supply base asset to the pool")
    public ResponseEntity<LenderPositionResponse> deposit(
            @PathVariable String account,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(LenderPositionResponse.from(
            lendingPool.deposit(account, request.getAmount())));
    }

    @PostMapping("/{account}/withdraw")
    @Operation(summary = "Withdraw supplied base asset")
    public ResponseEntity<LenderPositionResponse> withdraw(
            @PathVariable String account,
            @Valid @RequestBody AmountRequest request) {
        return ResponseEntity.ok(LenderPositionResponse.from(
            lendingPool.withdraw(account, request.getAmount())));
    }

    @GetMapping("/{account}")
    @Operation(summary = "Get a lender's supplied balance")
    public ResponseEntity<LenderPositionResponse> getLender(@PathVariable String account) {
        return ResponseEntity.ok(LenderPositionResponse.builder()
            .account(account)
            .amountSupplied(lendingPool.getLenderBalance(account))
            .build());
    }
}

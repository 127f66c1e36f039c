package com.lendingengine.api.controller;

import com.lendingengine.api.dto.BorrowerPositionResponse;
import com.lendingengine.api.dto.LiquidationRequest;
import com.lendingengine.api.dto.LiquidationStatusResponse;
import com.lendingengine.pool.LendingPool;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for checking and executing liquidations.
 */
@RestController
@RequestMapping("/api/v1/liquidations")
@RequiredArgsConstructor
@Tag(name = "Liquidations", description = "Liquidation eligibility and execution")
public class LiquidationController {

    private final LendingPool lendingPool;

    @GetMapping
    @Operation(summary = "List every position that can currently be liquidated")
    public ResponseEntity<List<LiquidationStatusResponse>> getLiquidatable() {
        return ResponseEntity.ok(lendingPool.findLiquidatablePositions().entrySet().stream()
            .map(entry -> LiquidationStatusResponse.of(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList()));
    }

    @GetMapping("/{borrower}")
    @Operation(summary = "Check whether a position can be liquidated")
    public ResponseEntity<LiquidationStatusResponse> getStatus(@PathVariable String borrower) {
        return ResponseEntity.ok(LiquidationStatusResponse.of(
            borrower, lendingPool.getLiquidationReasons(borrower)));
    }

    @PostMapping("/{borrower}")
    @Operation(summary = "Repay a position's debt and seize its collateral")
    public ResponseEntity<BorrowerPositionResponse> liquidate(
            @PathVariable String borrower,
            @Valid @RequestBody LiquidationRequest request) {
        return ResponseEntity.ok(BorrowerPositionResponse.from(
            lendingPool.liquidate(request.getLiquidator(), borrower)));
    }
}

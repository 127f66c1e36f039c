package com.lendingengine.api.controller;

import com.lendingengine.api.dto.FeeRecipientRequest;
import com.lendingengine.events.LendingEvent;
import com.lendingengine.events.LendingEventService;
import com.lendingengine.pool.LendingPool;
import com.lendingengine.pool.PoolOverview;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for pool parameters, owner administration and the event journal.
 */
@RestController
@RequestMapping("/api/v1/pool")
@RequiredArgsConstructor
@Tag(name = "Pool", description = "Pool parameters and administration")
public class PoolController {

    private final LendingPool lendingPool;
    private final LendingEventService eventService;

    @GetMapping
    @Operation(summary = "Get pool parameters and liquidity")
    public ResponseEntity<PoolOverview> getOverview() {
        return ResponseEntity.ok(lendingPool.getOverview());
    }

    @PutMapping("/fee-recipient")
    @Operation(summary = "Change the fee recipient (owner only)")
    public ResponseEntity<PoolOverview> updateFeeRecipient(@Valid @RequestBody FeeRecipientRequest request) {
        lendingPool.updateFeeRecipient(request.getCaller(), request.getFeeRecipient());
        return ResponseEntity.ok(lendingPool.getOverview());
    }

    @GetMapping("/events/{account}")
    @Operation(summary = "Get the event journal of an account")
    public ResponseEntity<List<LendingEvent>> getAccountEvents(@PathVariable String account) {
        return ResponseEntity.ok(eventService.getAccountEvents(account));
    }
}

package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO carrying an amount in asset units.
 * Zero and negative amounts are rejected by the engine with INVALID_AMOUNT.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AmountRequest {

    @NotNull(message = "Amount is required")
    private Long amount;
}

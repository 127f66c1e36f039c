package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for liquidating a position.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LiquidationRequest {

    @NotBlank(message = "Liquidator is required")
    private String liquidator;
}

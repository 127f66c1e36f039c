package com.lendingengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for the owner changing the fee recipient.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeeRecipientRequest {

    @NotBlank(message = "Caller is required")
    private String caller;

    @NotBlank(message = "Fee recipient is required")
    private String feeRecipient;
}

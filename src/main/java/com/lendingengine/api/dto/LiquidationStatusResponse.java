package com.lendingengine.api.dto;

import com.lendingengine.liquidation.LiquidationReason;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LiquidationStatusResponse {

    private String borrower;
    private boolean liquidatable;
    private List<LiquidationReason> reasons;

    public static LiquidationStatusResponse of(String borrower, List<LiquidationReason> reasons) {
        return new LiquidationStatusResponse(borrower, !reasons.isEmpty(), reasons);
    }
}

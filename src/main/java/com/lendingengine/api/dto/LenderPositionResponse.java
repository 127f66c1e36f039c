package com.lendingengine.api.dto;

import com.lendingengine.store.LenderRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LenderPositionResponse {

    private String account;
    private long amountSupplied;
    private Instant depositTimestamp;

    public static LenderPositionResponse from(LenderRecord record) {
        return LenderPositionResponse.builder()
            .account(record.getAccount())
            .amountSupplied(record.getAmountSupplied())
            .depositTimestamp(record.getDepositTimestamp())
            .build();
    }
}

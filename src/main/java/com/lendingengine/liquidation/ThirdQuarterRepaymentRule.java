package com.lendingengine.liquidation;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Days 181-270: at least 25% of lifetime principal must be repaid.
 */
@Component
@Order(3)
public class ThirdQuarterRepaymentRule extends RepaymentScheduleRule {

    public ThirdQuarterRepaymentRule() {
        super(180, 270, 2_500, LiquidationReason.THIRD_QUARTER_REPAYMENT_SHORTFALL);
    }

    @Override
    public String getRuleName() {
        return "ThirdQuarterRepayment";
    }
}

package com.lendingengine.liquidation;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Days 271-365: at least 50% of lifetime principal must be repaid.
 */
@Component
@Order(4)
public class FourthQuarterRepaymentRule extends RepaymentScheduleRule {

    public FourthQuarterRepaymentRule() {
        super(270, 365, 5_000, LiquidationReason.FOURTH_QUARTER_REPAYMENT_SHORTFALL);
    }

    @Override
    public String getRuleName() {
        return "FourthQuarterRepayment";
    }
}

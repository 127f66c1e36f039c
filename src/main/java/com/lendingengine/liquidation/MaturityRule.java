package com.lendingengine.liquidation;

import com.lendingengine.credit.InterestRateSchedule;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Rule that flags loans running past maturity, whatever their collateral.
 */
@Component
@Order(1)
public class MaturityRule implements LiquidationRule {

    @Override
    public Optional<LiquidationReason> evaluate(PositionSnapshot position) {
        if (position.getLoanAge().compareTo(InterestRateSchedule.MATURITY) > 0) {
            return Optional.of(LiquidationReason.MATURITY_EXCEEDED);
        }
        return Optional.empty();
    }

    @Override
    public String getRuleName() {
        return "Maturity";
    }
}

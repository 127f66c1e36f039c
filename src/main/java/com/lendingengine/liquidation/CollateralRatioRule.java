package com.lendingengine.liquidation;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Rule that flags positions whose collateral ratio fell below the pool threshold.
 */
@Component
@Order(2)
public class CollateralRatioRule implements LiquidationRule {

    @Override
    public Optional<LiquidationReason> evaluate(PositionSnapshot position) {
        if (position.getCollateralRatioBps() < position.getThresholdRatioBps()) {
            return Optional.of(LiquidationReason.UNDERCOLLATERALIZED);
        }
        return Optional.empty();
    }

    @Override
    public String getRuleName() {
        return "CollateralRatio";
    }
}

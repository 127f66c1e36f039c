package com.lendingengine.liquidation;

import java.util.Optional;

/**
 * One condition under which a position becomes liquidatable.
 *
 * Rules only read the snapshot. A position is liquidatable when any rule fires.
 */
public interface LiquidationRule {

    /**
     * Evaluate the rule against a position with an active loan.
     *
     * @param position snapshot of the position
     * @return the reason if the rule fires, empty otherwise
     */
    Optional<LiquidationReason> evaluate(PositionSnapshot position);

    /**
     * Get the name of this rule.
     */
    String getRuleName();
}

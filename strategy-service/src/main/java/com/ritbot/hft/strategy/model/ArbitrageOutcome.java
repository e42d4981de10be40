package com.ritbot.hft.strategy.model;

import com.ritbot.hft.market.Instrument;

import java.util.List;

/**
 * Result of one pass through the arbitrage state machine.
 *
 * @param stage last stage reached before returning to idle
 */
public record ArbitrageOutcome(
        ArbitrageStage stage,
        ArbitrageDirection direction,
        double edge,
        long quantity,
        List<Instrument> failedLegs,
        boolean currencyHedged,
        String reason
) {

    public ArbitrageOutcome {
        failedLegs = failedLegs == null ? List.of() : List.copyOf(failedLegs);
    }

    public static ArbitrageOutcome idle(ArbitrageStage stage, String reason) {
        return new ArbitrageOutcome(stage, null, 0.0, 0L, List.of(), false, reason);
    }

    public boolean traded() {
        return stage == ArbitrageStage.EXECUTE_LEGS || stage == ArbitrageStage.HEDGE_CURRENCY;
    }
}

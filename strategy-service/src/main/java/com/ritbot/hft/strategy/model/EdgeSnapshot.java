package com.ritbot.hft.strategy.model;

import java.util.Optional;

/**
 * Both arbitrage edges for one set of quotes, in base currency per composite unit.
 */
public record EdgeSnapshot(
        double syntheticSell,
        double syntheticBuy,
        double compositeAskBase,
        double compositeBidBase,
        double compositeCheapEdge,
        double compositeRichEdge
) {

    /**
     * Direction to trade at {@code threshold}; cheap wins when both qualify.
     */
    public Optional<ArbitrageDirection> select(double threshold) {
        if (compositeCheapEdge >= threshold) {
            return Optional.of(ArbitrageDirection.COMPOSITE_CHEAP);
        }
        if (compositeRichEdge >= threshold) {
            return Optional.of(ArbitrageDirection.COMPOSITE_RICH);
        }
        return Optional.empty();
    }

    public double edge(ArbitrageDirection direction) {
        return direction == ArbitrageDirection.COMPOSITE_CHEAP ? compositeCheapEdge : compositeRichEdge;
    }
}

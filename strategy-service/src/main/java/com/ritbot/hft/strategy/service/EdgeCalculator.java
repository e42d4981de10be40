package com.ritbot.hft.strategy.service;

import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.Quote;
import com.ritbot.hft.strategy.model.CycleState;
import com.ritbot.hft.strategy.model.EdgeSnapshot;

/**
 * Basket-vs-composite edges in base currency. The composite is quoted in the foreign
 * currency, so it is converted at the currency's touch on the side we would trade.
 */
public class EdgeCalculator {

    public EdgeSnapshot compute(CycleState state) {
        return compute(
                state.quote(Instrument.COMPONENT_A),
                state.quote(Instrument.COMPONENT_B),
                state.quote(Instrument.COMPOSITE),
                state.quote(Instrument.CURRENCY)
        );
    }

    public EdgeSnapshot compute(Quote componentA, Quote componentB, Quote composite, Quote currency) {
        double syntheticSell = componentA.bid() + componentB.bid();
        double syntheticBuy = componentA.ask() + componentB.ask();
        double compositeAskBase = composite.ask() * currency.ask();
        double compositeBidBase = composite.bid() * currency.bid();

        return new EdgeSnapshot(
                syntheticSell,
                syntheticBuy,
                compositeAskBase,
                compositeBidBase,
                syntheticSell - compositeAskBase,
                compositeBidBase - syntheticBuy
        );
    }
}

package com.ritbot.hft.strategy.model;

import com.ritbot.hft.rit.api.OrderSide;

public enum ArbitrageDirection {
    /**
     * Composite trades below the basket: buy composite, sell both components.
     */
    COMPOSITE_CHEAP(OrderSide.BUY),
    /**
     * Composite trades above the basket: sell composite, buy both components.
     */
    COMPOSITE_RICH(OrderSide.SELL);

    private final OrderSide compositeSide;

    ArbitrageDirection(OrderSide compositeSide) {
        this.compositeSide = compositeSide;
    }

    public OrderSide compositeSide() {
        return compositeSide;
    }

    public OrderSide componentSide() {
        return compositeSide.opposite();
    }
}

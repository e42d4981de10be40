package com.ritbot.hft.strategy.model;

import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.rit.api.OrderStyle;

public record OrderIntent(
        Instrument instrument,
        OrderSide side,
        long quantity,
        OrderStyle style,
        Double price
) {

    public static OrderIntent market(Instrument instrument, OrderSide side, long quantity) {
        return new OrderIntent(instrument, side, quantity, OrderStyle.MARKET, null);
    }

    public static OrderIntent limit(Instrument instrument, OrderSide side, long quantity, double price) {
        return new OrderIntent(instrument, side, quantity, OrderStyle.LIMIT, price);
    }

    public long signedQuantity() {
        return side.sign() * quantity;
    }

    public OrderIntent withQuantity(long newQuantity) {
        return new OrderIntent(instrument, side, newQuantity, style, price);
    }
}

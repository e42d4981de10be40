package com.ritbot.hft.rit.api;

/**
 * Block offer proposed by the venue. {@code action} is from our side of the trade:
 * {@link OrderSide#BUY} means accepting makes us long the composite.
 */
public record TenderOffer(
    long id,
    String ticker,
    OrderSide action,
    double price,
    long quantity
) {
}

package com.ritbot.hft.events.payload;

/**
 * A hedge chunk could not be placed within the retry budget; the book carries naked exposure.
 */
public record HedgeExhaustedEvent(
    String ticker,
    String side,
    long requestedQuantity,
    long unhedgedQuantity,
    int attempts,
    String reason
) {
}

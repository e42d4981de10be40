package com.ritbot.hft.events.payload;

/**
 * Suggestion to use the venue converter. {@code direction} is REDEEM (composite to basket)
 * or CREATE (basket to composite).
 */
public record ConverterAdvisoryEvent(
    String direction,
    long compositePosition,
    long componentAPosition,
    long componentBPosition,
    double compositeSpread,
    double basketSpread,
    double grossUsage,
    double feeInBaseCurrency
) {
}

package com.ritbot.hft.events.payload;

public record TenderDecisionEvent(
    long tenderId,
    String action,
    double price,
    long quantity,
    double profitPerShare,
    boolean accepted,
    boolean liquidated,
    String reason
) {
}

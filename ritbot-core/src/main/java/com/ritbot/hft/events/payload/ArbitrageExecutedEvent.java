package com.ritbot.hft.events.payload;

import java.util.List;

public record ArbitrageExecutedEvent(
    String direction,
    double edge,
    long quantity,
    List<String> failedLegs,
    boolean currencyHedged
) {
}

package com.ritbot.hft.events.payload;

public record UnwindStateEvent(
    String state,
    int tick,
    long grossExposure,
    long netExposure,
    double triggerLevel
) {
}

package com.ritbot.hft.events;

import java.time.Instant;

/**
 * Envelope carried on the application event bus.
 */
public record EngineEvent(
    Instant ts,
    String type,
    String key,
    Object payload
) {
}

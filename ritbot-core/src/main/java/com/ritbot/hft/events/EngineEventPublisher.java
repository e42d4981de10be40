package com.ritbot.hft.events;

import java.time.Instant;

/**
 * Sink for structured engine events. Presentation layers (alerts, dashboards) subscribe
 * to these instead of the engine driving them directly.
 */
public interface EngineEventPublisher {

  void publish(Instant ts, String type, String key, Object payload);

  static EngineEventPublisher noop() {
    return (ts, type, key, payload) -> {
    };
  }
}

package com.ritbot.hft.strategy.events;

import com.ritbot.hft.events.EngineEvent;
import com.ritbot.hft.events.EngineEventPublisher;
import com.ritbot.hft.events.EngineEventTypes;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Logs engine events and forwards them on the Spring application event bus.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEngineEventPublisher implements EngineEventPublisher {

    private final @NonNull ApplicationEventPublisher applicationEvents;

    @Override
    public void publish(Instant ts, String type, String key, Object payload) {
        if (EngineEventTypes.HEDGE_EXHAUSTED.equals(type)) {
            log.error("EVENT {} key={} payload={}", type, key, payload);
        } else if (EngineEventTypes.TENDER_REJECTED.equals(type)) {
            log.debug("EVENT {} key={} payload={}", type, key, payload);
        } else {
            log.info("EVENT {} key={} payload={}", type, key, payload);
        }
        try {
            applicationEvents.publishEvent(new EngineEvent(ts, type, key, payload));
        } catch (Exception e) {
            log.warn("event listener failed for type={} key={}: {}", type, key, e.toString());
        }
    }
}

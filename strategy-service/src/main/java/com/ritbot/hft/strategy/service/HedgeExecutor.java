package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.events.EngineEventPublisher;
import com.ritbot.hft.events.EngineEventTypes;
import com.ritbot.hft.events.payload.HedgeExhaustedEvent;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.Quote;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.strategy.metrics.StrategyMetricsService;
import com.ritbot.hft.strategy.model.OrderIntent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Places offsetting trades that must go through. Each chunk is retried with backoff until
 * the venue acknowledges it or the attempt budget runs out; hedges bypass the risk limiter.
 */
@Slf4j
public class HedgeExecutor {

    private final OrderRouter router;
    private final ExponentialBackoff backoff;
    private final Sleeper sleeper;
    private final ArbProperties.Hedge cfg;
    private final EngineEventPublisher events;
    private final Clock clock;
    private final StrategyMetricsService metrics;

    public HedgeExecutor(OrderRouter router, ArbProperties.Hedge cfg, EngineEventPublisher events, Clock clock,
                         StrategyMetricsService metrics) {
        this(router, cfg, d -> Thread.sleep(d.toMillis()), events, clock, metrics);
    }

    public HedgeExecutor(OrderRouter router, ArbProperties.Hedge cfg, Sleeper sleeper, EngineEventPublisher events,
                         Clock clock, StrategyMetricsService metrics) {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.cfg = Objects.requireNonNull(cfg, "cfg must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.backoff = new ExponentialBackoff(
                Duration.ofMillis(cfg.initialBackoffMillis()),
                Duration.ofMillis(cfg.maxBackoffMillis()),
                cfg.backoffMultiplier()
        );
    }

    public boolean hedge(Instrument instrument, OrderSide side, long quantity) {
        return hedge(instrument, side, quantity, null);
    }

    /**
     * @param quote current touch, used for the passive first attempt when enabled; may be null
     * @return false if any chunk exhausted its retries; remaining chunks are still attempted
     */
    public boolean hedge(Instrument instrument, OrderSide side, long quantity, Quote quote) {
        if (quantity <= 0) {
            return true;
        }
        boolean allPlaced = true;
        long remaining = quantity;
        Interruption interruption = new Interruption();
        try {
            for (long chunk : router.chunks(instrument, quantity)) {
                if (placeChunk(instrument, side, chunk, quote, interruption)) {
                    remaining -= chunk;
                    continue;
                }
                allPlaced = false;
                reportExhausted(instrument, side, quantity, chunk);
            }
        } finally {
            interruption.restore();
        }
        if (!allPlaced) {
            log.error("HEDGE EXHAUSTED: {} {} {} left {} unhedged", side, quantity, instrument, remaining);
        }
        return allPlaced;
    }

    private boolean placeChunk(Instrument instrument, OrderSide side, long chunk, Quote quote,
                               Interruption interruption) {
        if (Boolean.TRUE.equals(cfg.passiveFirst()) && quote != null && quote.isTwoSided()) {
            double touch = side == OrderSide.BUY ? quote.ask() : quote.bid();
            if (router.submitOnce(OrderIntent.limit(instrument, side, chunk, touch))) {
                return true;
            }
            log.warn("passive hedge not placed for {} {} {}, falling back to market", side, chunk, instrument);
        }

        int maxAttempts = Math.max(1, cfg.maxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (router.submitOnce(OrderIntent.market(instrument, side, chunk))) {
                return true;
            }
            if (attempt < maxAttempts) {
                log.warn("hedge failed ({} {} {}), retrying {}/{}", instrument, side, chunk, attempt, maxAttempts);
                metrics.recordHedgeRetry();
                sleep(backoff.backoffForAttempt(attempt), interruption);
            }
        }
        return false;
    }

    private void reportExhausted(Instrument instrument, OrderSide side, long requested, long chunk) {
        metrics.recordHedgeExhausted();
        events.publish(clock.instant(), EngineEventTypes.HEDGE_EXHAUSTED, instrument.name(), new HedgeExhaustedEvent(
                instrument.name(),
                side.name(),
                requested,
                chunk,
                Math.max(1, cfg.maxAttempts()),
                "retry budget exhausted"
        ));
    }

    /**
     * Waits the full backoff even if interrupted. The interrupt is held back until the hedge
     * returns so the remaining attempts still reach the venue.
     */
    private void sleep(Duration duration, Interruption interruption) {
        Instant deadline = clock.instant().plus(duration);
        Duration remaining = duration;
        while (!remaining.isZero() && !remaining.isNegative()) {
            try {
                sleeper.sleep(remaining);
                return;
            } catch (InterruptedException e) {
                if (!interruption.interrupted) {
                    log.warn("interrupted during hedge backoff, finishing remaining attempts");
                }
                interruption.interrupted = true;
                remaining = Duration.between(clock.instant(), deadline);
            }
        }
    }

    private static final class Interruption {
        private boolean interrupted;

        void restore() {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}

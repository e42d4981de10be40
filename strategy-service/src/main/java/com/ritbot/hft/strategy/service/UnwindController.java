package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.events.EngineEventPublisher;
import com.ritbot.hft.events.EngineEventTypes;
import com.ritbot.hft.events.payload.UnwindStateEvent;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.Quote;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.strategy.metrics.StrategyMetricsService;
import com.ritbot.hft.strategy.model.CycleState;
import com.ritbot.hft.strategy.model.ExposureSnapshot;
import com.ritbot.hft.strategy.model.OrderIntent;
import com.ritbot.hft.strategy.model.PositionSnapshot;
import com.ritbot.hft.strategy.model.UnwindState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Two-state liquidation controller. Engages once gross exposure goes above
 * {@code trigger * grossLimit} and releases only when gross is strictly below the same line.
 * While engaged, new arbitrage and tenders are suspended and every share position is worked
 * down in bounded chunks: at market while the book's weighted gross is above the aggressive
 * threshold, otherwise with passive limits.
 */
@Slf4j
public class UnwindController {

    private static final List<Instrument> SHARE_INSTRUMENTS =
            List.of(Instrument.COMPOSITE, Instrument.COMPONENT_A, Instrument.COMPONENT_B);

    private final ArbProperties.Unwind cfg;
    private final ArbProperties.Risk risk;
    private final OrderRouter router;
    private final EngineEventPublisher events;
    private final Clock clock;
    private final StrategyMetricsService metrics;

    private final AtomicReference<UnwindState> state = new AtomicReference<>(UnwindState.NORMAL);

    public UnwindController(ArbProperties.Unwind cfg, ArbProperties.Risk risk, OrderRouter router,
                            EngineEventPublisher events, Clock clock, StrategyMetricsService metrics) {
        this.cfg = cfg;
        this.risk = risk;
        this.router = router;
        this.events = events;
        this.clock = clock;
        this.metrics = metrics;
    }

    public UnwindState state() {
        return state.get();
    }

    public boolean isUnwinding() {
        return state.get() == UnwindState.UNWINDING;
    }

    public double triggerLevel() {
        return cfg.trigger() * risk.grossLimit();
    }

    /**
     * Applies the hysteresis rule to the cycle's exposure and returns the resulting state.
     */
    public UnwindState update(CycleState cycle) {
        if (!Boolean.TRUE.equals(cfg.enabled())) {
            return state.get();
        }
        ExposureSnapshot exposure = cycle.positions().exposure();
        double line = triggerLevel();

        if (state.get() == UnwindState.NORMAL && exposure.gross() > line) {
            state.set(UnwindState.UNWINDING);
            log.warn("UNWIND: engaged at gross={} (line={}) tick={}", exposure.gross(), line, cycle.tick());
            publish(EngineEventTypes.UNWIND_ENGAGED, cycle, exposure, line);
        } else if (state.get() == UnwindState.UNWINDING && exposure.gross() < line) {
            state.set(UnwindState.NORMAL);
            log.info("UNWIND: released at gross={} (line={}) tick={}", exposure.gross(), line, cycle.tick());
            publish(EngineEventTypes.UNWIND_RELEASED, cycle, exposure, line);
        }
        return state.get();
    }

    /**
     * Sends one round of offsetting orders while unwinding.
     *
     * @return number of orders the venue acknowledged
     */
    public int step(CycleState cycle) {
        if (!isUnwinding()) {
            return 0;
        }
        boolean aggressive = isAggressive(cycle.positions().exposure());
        int sent = 0;
        for (Instrument instrument : SHARE_INSTRUMENTS) {
            OrderIntent intent = offsetOrder(instrument, cycle.position(instrument), cycle.quote(instrument), aggressive);
            if (intent == null) continue;
            if (router.submitOnce(intent)) {
                sent++;
            }
        }
        metrics.recordUnwindOrders(sent);
        return sent;
    }

    /**
     * Closes every share position at market. Used to clear headroom for a tender worth more
     * than the liquidation margin.
     *
     * @return true when every close-out was fully acknowledged
     */
    public boolean flatten(PositionSnapshot positions) {
        boolean complete = true;
        for (Instrument instrument : SHARE_INSTRUMENTS) {
            long position = positions.position(instrument);
            if (position == 0) continue;
            OrderIntent close = OrderIntent.market(instrument, OrderSide.forDelta(-position), Math.abs(position));
            long acknowledged = router.submit(close);
            if (acknowledged < close.quantity()) {
                complete = false;
            }
        }
        log.warn("UNWIND: flattened share book for liquidation (complete={})", complete);
        return complete;
    }

    /**
     * One order style for the whole book, so hedged legs are worked the same way.
     */
    boolean isAggressive(ExposureSnapshot exposure) {
        return exposure.gross() > cfg.aggressiveThreshold();
    }

    OrderIntent offsetOrder(Instrument instrument, long position, Quote quote, boolean aggressive) {
        long size = Math.abs(position);
        if (size == 0 || size < cfg.minResidual()) {
            return null;
        }
        if (!quote.isTwoSided()) {
            log.debug("UNWIND: no two-sided quote for {}, skipping", instrument);
            return null;
        }
        OrderSide side = OrderSide.forDelta(-position);
        long quantity = Math.min(Math.min(cfg.chunkSize(), size), router.maxOrderSize(instrument));

        if (aggressive) {
            return OrderIntent.market(instrument, side, quantity);
        }
        double price = side == OrderSide.SELL
                ? Math.max(quote.bid(), quote.ask() - cfg.limitOffset())
                : Math.min(quote.ask(), quote.bid() + cfg.limitOffset());
        return OrderIntent.limit(instrument, side, quantity, price);
    }

    private void publish(String type, CycleState cycle, ExposureSnapshot exposure, double line) {
        events.publish(clock.instant(), type, state.get().name(), new UnwindStateEvent(
                state.get().name(),
                cycle.tick(),
                exposure.gross(),
                exposure.net(),
                line
        ));
    }
}

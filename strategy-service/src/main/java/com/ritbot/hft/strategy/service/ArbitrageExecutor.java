package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.events.EngineEventPublisher;
import com.ritbot.hft.events.EngineEventTypes;
import com.ritbot.hft.events.payload.ArbitrageExecutedEvent;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.Quote;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.strategy.metrics.StrategyMetricsService;
import com.ritbot.hft.strategy.model.ArbitrageDirection;
import com.ritbot.hft.strategy.model.ArbitrageOutcome;
import com.ritbot.hft.strategy.model.ArbitrageStage;
import com.ritbot.hft.strategy.model.CycleState;
import com.ritbot.hft.strategy.model.EdgeSnapshot;
import com.ritbot.hft.strategy.model.OrderIntent;
import com.ritbot.hft.strategy.model.RiskDecision;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Basket-vs-composite arbitrage. One pass runs
 * IDLE, EVALUATE, RISK_CHECK, EXECUTE_LEGS, HEDGE_CURRENCY and returns to IDLE,
 * dropping out early when there is no edge, no size, or the limiter denies.
 *
 * <p>Legs are sent independently. A leg that fails is reported and left for the
 * delta-hedge check, the currency rebalancer or the unwind to correct on a later cycle.
 */
@Slf4j
public class ArbitrageExecutor {

    private final EdgeCalculator edges;
    private final SizingPolicy sizing;
    private final RiskLimiter limiter;
    private final OrderRouter router;
    private final HedgeExecutor hedger;
    private final ArbProperties.Arbitrage cfg;
    private final EngineEventPublisher events;
    private final Clock clock;
    private final StrategyMetricsService metrics;

    private final AtomicReference<ArbitrageStage> stage = new AtomicReference<>(ArbitrageStage.IDLE);
    private final AtomicReference<ArbitrageOutcome> lastOutcome =
            new AtomicReference<>(ArbitrageOutcome.idle(ArbitrageStage.IDLE, "not run"));

    public ArbitrageExecutor(EdgeCalculator edges, SizingPolicy sizing, RiskLimiter limiter, OrderRouter router,
                             HedgeExecutor hedger, ArbProperties.Arbitrage cfg, EngineEventPublisher events,
                             Clock clock, StrategyMetricsService metrics) {
        this.edges = edges;
        this.sizing = sizing;
        this.limiter = limiter;
        this.router = router;
        this.hedger = hedger;
        this.cfg = cfg;
        this.events = events;
        this.clock = clock;
        this.metrics = metrics;
    }

    public ArbitrageOutcome run(CycleState state, boolean unwinding) {
        try {
            ArbitrageOutcome outcome = runStages(state, unwinding);
            lastOutcome.set(outcome);
            return outcome;
        } finally {
            stage.set(ArbitrageStage.IDLE);
        }
    }

    public ArbitrageStage stage() {
        return stage.get();
    }

    public ArbitrageOutcome lastOutcome() {
        return lastOutcome.get();
    }

    private ArbitrageOutcome runStages(CycleState state, boolean unwinding) {
        if (!Boolean.TRUE.equals(cfg.enabled())) {
            return ArbitrageOutcome.idle(ArbitrageStage.IDLE, "disabled");
        }
        if (unwinding) {
            return ArbitrageOutcome.idle(ArbitrageStage.IDLE, "unwinding");
        }

        stage.set(ArbitrageStage.EVALUATE);
        EdgeSnapshot snapshot = edges.compute(state);
        Optional<ArbitrageDirection> selected = snapshot.select(cfg.edgeThreshold());
        if (selected.isEmpty()) {
            return ArbitrageOutcome.idle(ArbitrageStage.EVALUATE, "no edge");
        }
        ArbitrageDirection direction = selected.get();
        double edge = snapshot.edge(direction);
        long quantity = sizing.quantityFor(edge);
        if (quantity <= 0) {
            return ArbitrageOutcome.idle(ArbitrageStage.EVALUATE, "size zero");
        }

        stage.set(ArbitrageStage.RISK_CHECK);
        List<OrderIntent> legs = legs(direction, quantity);
        RiskDecision decision = limiter.evaluate(state.positions(), legs, state.quotes());
        if (!decision.allowed()) {
            log.debug("ARB: {} edge={} qty={} denied (gross {} -> {})", direction, edge, quantity,
                    decision.current().gross(), decision.projected().gross());
            return new ArbitrageOutcome(ArbitrageStage.RISK_CHECK, direction, edge, quantity, List.of(), false, "limit");
        }

        stage.set(ArbitrageStage.EXECUTE_LEGS);
        log.info("ARB: {} edge={} qty={} (synthSell={} synthBuy={} compAsk={} compBid={})",
                direction, String.format("%.4f", edge), quantity,
                snapshot.syntheticSell(), snapshot.syntheticBuy(),
                snapshot.compositeAskBase(), snapshot.compositeBidBase());

        List<Instrument> failedLegs = new ArrayList<>();
        long compositeFilled = 0;
        for (OrderIntent leg : legs) {
            long acknowledged = router.submit(leg);
            if (acknowledged < leg.quantity()) {
                failedLegs.add(leg.instrument());
                log.warn("ARB: leg {} {} acknowledged {}/{}", leg.side(), leg.instrument(), acknowledged, leg.quantity());
            }
            if (leg.instrument() == Instrument.COMPOSITE) {
                compositeFilled = acknowledged;
            }
        }

        boolean currencyHedged = false;
        if (compositeFilled > 0) {
            stage.set(ArbitrageStage.HEDGE_CURRENCY);
            Quote composite = state.quote(Instrument.COMPOSITE);
            double executionPrice = direction.compositeSide() == OrderSide.BUY ? composite.ask() : composite.bid();
            long notional = Math.round(compositeFilled * executionPrice);
            OrderSide currencySide = direction.compositeSide().opposite();
            currencyHedged = hedger.hedge(Instrument.CURRENCY, currencySide, notional, state.quote(Instrument.CURRENCY));
        }

        metrics.recordArbitrageTrade();
        List<String> failedNames = failedLegs.stream().map(Instrument::name).toList();
        events.publish(clock.instant(), EngineEventTypes.ARBITRAGE_EXECUTED, direction.name(),
                new ArbitrageExecutedEvent(direction.name(), edge, quantity, failedNames, currencyHedged));

        ArbitrageStage reached = compositeFilled > 0 ? ArbitrageStage.HEDGE_CURRENCY : ArbitrageStage.EXECUTE_LEGS;
        return new ArbitrageOutcome(reached, direction, edge, quantity, failedLegs, currencyHedged,
                failedLegs.isEmpty() ? "executed" : "partial");
    }

    static List<OrderIntent> legs(ArbitrageDirection direction, long quantity) {
        OrderSide componentSide = direction.componentSide();
        return List.of(
                OrderIntent.market(Instrument.COMPONENT_A, componentSide, quantity),
                OrderIntent.market(Instrument.COMPONENT_B, componentSide, quantity),
                OrderIntent.market(Instrument.COMPOSITE, direction.compositeSide(), quantity)
        );
    }
}

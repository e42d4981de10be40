package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.strategy.model.CycleState;
import com.ritbot.hft.strategy.model.OrderIntent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * First check of every cycle: each component should hold the negative of the composite
 * position. Gaps above the threshold (a failed arbitrage leg, a partial hedge) are closed
 * one order ceiling at a time, subject to the limiter.
 */
@Slf4j
public class DeltaHedgeMonitor {

    private static final List<Instrument> COMPONENTS = List.of(Instrument.COMPONENT_A, Instrument.COMPONENT_B);

    private final HedgeExecutor hedger;
    private final RiskLimiter limiter;
    private final OrderRouter router;
    private final ArbProperties.DeltaHedge cfg;

    public DeltaHedgeMonitor(HedgeExecutor hedger, RiskLimiter limiter, OrderRouter router,
                             ArbProperties.DeltaHedge cfg) {
        this.hedger = hedger;
        this.limiter = limiter;
        this.router = router;
        this.cfg = cfg;
    }

    /**
     * @return number of component hedges sent
     */
    public int check(CycleState state) {
        if (!Boolean.TRUE.equals(cfg.enabled())) {
            return 0;
        }
        long target = -state.position(Instrument.COMPOSITE);
        int hedged = 0;
        for (Instrument component : COMPONENTS) {
            long gap = target - state.position(component);
            if (Math.abs(gap) <= cfg.componentThreshold()) {
                continue;
            }
            OrderSide side = OrderSide.forDelta(gap);
            long quantity = Math.min(Math.abs(gap), router.maxOrderSize(component));
            if (!limiter.evaluate(state.positions(), OrderIntent.market(component, side, quantity)).allowed()) {
                log.debug("DELTA: {} gap {} not hedged, limiter denied", component, gap);
                continue;
            }
            log.info("DELTA: {} gap {} -> {} {}", component, gap, side, quantity);
            hedger.hedge(component, side, quantity, state.quote(component));
            hedged++;
        }
        return hedged;
    }
}

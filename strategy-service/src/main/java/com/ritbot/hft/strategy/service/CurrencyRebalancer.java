package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.Quote;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.strategy.metrics.StrategyMetricsService;
import com.ritbot.hft.strategy.model.CycleState;
import com.ritbot.hft.strategy.model.OrderIntent;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Keeps the currency position offsetting the composite's foreign-currency value:
 * target = -(composite position * composite mid). Drift inside the tolerance band is left alone.
 */
@Slf4j
public class CurrencyRebalancer {

    private final OrderRouter router;
    private final ArbProperties.Rebalance cfg;
    private final StrategyMetricsService metrics;

    public CurrencyRebalancer(OrderRouter router, ArbProperties.Rebalance cfg, StrategyMetricsService metrics) {
        if (cfg.driftTolerance() == null || cfg.driftTolerance() <= 0) {
            throw new IllegalArgumentException("drift tolerance must be positive");
        }
        this.router = router;
        this.cfg = cfg;
        this.metrics = metrics;
    }

    /**
     * The corrective currency order for this cycle, if any.
     */
    public Optional<OrderIntent> plan(CycleState state) {
        if (!Boolean.TRUE.equals(cfg.enabled())) {
            return Optional.empty();
        }
        long composite = state.position(Instrument.COMPOSITE);
        if (cfg.minCompositePosition() > 0 && Math.abs(composite) < cfg.minCompositePosition()) {
            return Optional.empty();
        }

        double target = 0.0;
        if (composite != 0) {
            Quote quote = state.quote(Instrument.COMPOSITE);
            if (!quote.isTwoSided()) {
                log.debug("rebalance skipped: composite quote not two-sided");
                return Optional.empty();
            }
            target = -(composite * quote.mid());
        }
        double drift = target - state.position(Instrument.CURRENCY);
        if (Math.abs(drift) <= cfg.driftTolerance()) {
            return Optional.empty();
        }
        long quantity = Math.round(Math.abs(drift));
        return Optional.of(OrderIntent.market(Instrument.CURRENCY, OrderSide.forDelta(drift), quantity));
    }

    /**
     * @return true when a corrective order was acknowledged
     */
    public boolean rebalance(CycleState state) {
        Optional<OrderIntent> plan = plan(state);
        if (plan.isEmpty()) {
            return false;
        }
        OrderIntent order = plan.get();
        log.info("CURRENCY: drift correction {} {}", order.side(), order.quantity());
        long acknowledged = router.submit(order);
        if (acknowledged > 0) {
            metrics.recordCurrencyRebalance();
        }
        return acknowledged > 0;
    }
}

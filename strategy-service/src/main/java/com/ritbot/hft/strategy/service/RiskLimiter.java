package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.Quote;
import com.ritbot.hft.strategy.model.ExposureSnapshot;
import com.ritbot.hft.strategy.model.OrderIntent;
import com.ritbot.hft.strategy.model.PositionSnapshot;
import com.ritbot.hft.strategy.model.RiskDecision;
import com.ritbot.hft.strategy.model.RiskDecision.Rule;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Gross/net exposure gate. A trade passes when the projected book is inside both limits,
 * or when it shrinks gross, or when it pulls net back toward zero. Currency legs are exempt.
 */
@Slf4j
public class RiskLimiter {

    private final ArbProperties.Risk cfg;

    public RiskLimiter(ArbProperties.Risk cfg) {
        this.cfg = cfg;
    }

    public RiskDecision evaluate(PositionSnapshot current, OrderIntent intent) {
        return evaluate(current, List.of(intent), null);
    }

    public RiskDecision evaluate(PositionSnapshot current, List<OrderIntent> legs) {
        return evaluate(current, legs, null);
    }

    /**
     * Checks a package of legs as if all filled together.
     *
     * @param quotes marks for the optional cash-notional check; ignored when null or when the check is off
     */
    public RiskDecision evaluate(PositionSnapshot current, List<OrderIntent> legs, Map<Instrument, Quote> quotes) {
        ExposureSnapshot now = current.exposure();
        List<OrderIntent> shareLegs = legs.stream()
                .filter(leg -> !leg.instrument().isCurrency())
                .toList();
        if (shareLegs.isEmpty()) {
            return RiskDecision.allow(Rule.CURRENCY_EXEMPT, now, now);
        }

        PositionSnapshot projectedPositions = current.apply(shareLegs);
        ExposureSnapshot projected = projectedPositions.exposure();

        RiskDecision shares = decide(now, projected, cfg.grossLimit(), cfg.netLimit());
        if (!shares.allowed()) {
            log.debug("limit breach: gross {} -> {}, net {} -> {} (limits {}/{})",
                    now.gross(), projected.gross(), now.net(), projected.net(), cfg.grossLimit(), cfg.netLimit());
            return shares;
        }

        if (Boolean.TRUE.equals(cfg.cashCheckEnabled()) && quotes != null) {
            double[] cashNow = cashNotional(current, quotes);
            double[] cashProjected = cashNotional(projectedPositions, quotes);
            boolean cashOk = withinBand(cashProjected[0], cashProjected[1], cfg.cashLimit(), cfg.cashLimit())
                    || cashProjected[0] < cashNow[0]
                    || Math.abs(cashProjected[1]) < Math.abs(cashNow[1]);
            if (!cashOk) {
                log.debug("cash limit breach: gross notional {} -> {} (limit {})",
                        cashNow[0], cashProjected[0], cfg.cashLimit());
                return RiskDecision.deny(Rule.CASH_LIMIT, now, projected);
            }
        }
        return shares;
    }

    static RiskDecision decide(ExposureSnapshot now, ExposureSnapshot projected, long grossLimit, long netLimit) {
        if (withinBand(projected.gross(), projected.net(), grossLimit, netLimit)) {
            return RiskDecision.allow(Rule.WITHIN_LIMITS, now, projected);
        }
        if (projected.gross() < now.gross()) {
            return RiskDecision.allow(Rule.REDUCES_GROSS, now, projected);
        }
        if (Math.abs(projected.net()) < Math.abs(now.net())) {
            return RiskDecision.allow(Rule.REDUCES_NET, now, projected);
        }
        return RiskDecision.deny(Rule.DENIED, now, projected);
    }

    private static boolean withinBand(double gross, double net, double grossLimit, double netLimit) {
        return gross < grossLimit && net >= -netLimit && net <= netLimit;
    }

    /**
     * Base-currency notional of the share book as {gross, net}. The composite is marked
     * at its mid converted through the currency mid; unmarked instruments count as zero.
     */
    private static double[] cashNotional(PositionSnapshot positions, Map<Instrument, Quote> quotes) {
        double fx = mid(quotes, Instrument.CURRENCY);
        double gross = 0.0;
        double net = 0.0;
        for (Instrument instrument : Instrument.values()) {
            if (instrument.isCurrency()) continue;
            double mark = mid(quotes, instrument);
            if (instrument == Instrument.COMPOSITE) {
                mark *= fx;
            }
            double value = positions.position(instrument) * mark;
            gross += Math.abs(value);
            net += value;
        }
        return new double[]{gross, net};
    }

    private static double mid(Map<Instrument, Quote> quotes, Instrument instrument) {
        Quote quote = quotes.get(instrument);
        return quote == null ? 0.0 : quote.mid();
    }
}

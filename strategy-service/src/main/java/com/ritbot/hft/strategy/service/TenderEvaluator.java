package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.events.EngineEventPublisher;
import com.ritbot.hft.events.EngineEventTypes;
import com.ritbot.hft.events.payload.TenderDecisionEvent;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.InstrumentTickers;
import com.ritbot.hft.market.Quote;
import com.ritbot.hft.rit.api.OrderBook;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.rit.api.TenderOffer;
import com.ritbot.hft.strategy.metrics.StrategyMetricsService;
import com.ritbot.hft.strategy.model.CycleState;
import com.ritbot.hft.strategy.model.OrderIntent;
import com.ritbot.hft.strategy.model.PositionSnapshot;
import com.ritbot.hft.strategy.model.RiskDecision;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Accepts or ignores venue block offers on the composite.
 *
 * <p>Per-share profit in base currency:
 * <ul>
 *   <li>BUY (we take the composite): basket sale value - price * currency ask</li>
 *   <li>SELL (we give the composite): price * currency bid - basket purchase cost</li>
 * </ul>
 * An accepted offer is hedged unconditionally: both components on the opposite side and,
 * when configured, the currency notional.
 *
 * <p>An offer over the limits may still be taken above the liquidation margin, but only if it
 * fits a flat share book and every close-out order is acknowledged first.
 */
@Slf4j
public class TenderEvaluator {

    private final MarketDataGateway marketData;
    private final PositionLedger ledger;
    private final RiskLimiter limiter;
    private final OrderRouter router;
    private final HedgeExecutor hedger;
    private final UnwindController unwind;
    private final InstrumentTickers tickers;
    private final ArbProperties.Tender cfg;
    private final EngineEventPublisher events;
    private final Clock clock;
    private final StrategyMetricsService metrics;

    public TenderEvaluator(MarketDataGateway marketData, PositionLedger ledger, RiskLimiter limiter,
                           OrderRouter router, HedgeExecutor hedger, UnwindController unwind,
                           InstrumentTickers tickers, ArbProperties.Tender cfg, EngineEventPublisher events,
                           Clock clock, StrategyMetricsService metrics) {
        this.marketData = marketData;
        this.ledger = ledger;
        this.limiter = limiter;
        this.router = router;
        this.hedger = hedger;
        this.unwind = unwind;
        this.tickers = tickers;
        this.cfg = cfg;
        this.events = events;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * @return number of offers accepted this cycle
     */
    public int evaluate(CycleState state) {
        if (!Boolean.TRUE.equals(cfg.enabled()) || unwind.isUnwinding()) {
            return 0;
        }
        List<TenderOffer> offers = marketData.openTenders();
        if (offers.isEmpty()) {
            return 0;
        }

        String compositeTicker = tickers.ticker(Instrument.COMPOSITE);
        PositionSnapshot positions = state.positions();
        int accepted = 0;
        for (TenderOffer offer : offers) {
            if (offer.ticker() != null && !compositeTicker.equalsIgnoreCase(offer.ticker())) {
                continue;
            }
            Optional<PositionSnapshot> after = consider(offer, state.withPositions(positions));
            if (after.isPresent()) {
                accepted++;
                positions = after.get();
            }
        }
        return accepted;
    }

    /**
     * Evaluates and, if worthwhile, accepts one offer.
     *
     * @return refreshed positions when the offer was accepted
     */
    Optional<PositionSnapshot> consider(TenderOffer offer, CycleState state) {
        OptionalDouble profit = profitPerShare(offer, state);
        if (profit.isEmpty()) {
            reject(offer, Double.NaN, "insufficient depth");
            return Optional.empty();
        }
        double perShare = profit.getAsDouble();
        if (!(perShare > cfg.margin())) {
            reject(offer, perShare, "below margin");
            return Optional.empty();
        }

        OrderIntent compositeLeg = OrderIntent.market(Instrument.COMPOSITE, offer.action(), offer.quantity());
        RiskDecision decision = limiter.evaluate(state.positions(), List.of(compositeLeg), state.quotes());
        boolean liquidated = false;
        CycleState base = state;
        if (!decision.allowed()) {
            if (!Boolean.TRUE.equals(cfg.liquidationEnabled()) || !(perShare > cfg.liquidationMargin())) {
                reject(offer, perShare, "limit");
                return Optional.empty();
            }
            CycleState flat = state.withPositions(state.positions().withSharesFlat());
            if (!limiter.evaluate(flat.positions(), List.of(compositeLeg), flat.quotes()).allowed()) {
                reject(offer, perShare, "limit");
                return Optional.empty();
            }
            log.warn("TENDER: {} profit {} clears liquidation margin, flattening before accept",
                    offer.id(), String.format("%.4f", perShare));
            if (!unwind.flatten(state.positions())) {
                log.warn("TENDER: {} not accepted, share book could not be flattened", offer.id());
                reject(offer, perShare, "liquidation incomplete");
                return Optional.empty();
            }
            liquidated = true;
            base = flat;
        }

        if (!router.acceptTender(offer.id())) {
            reject(offer, perShare, "accept failed");
            return Optional.empty();
        }

        log.info("TENDER: accepted {} {} {} @ {} profit/share={}", offer.id(), offer.action(), offer.quantity(),
                offer.price(), String.format("%.4f", perShare));
        metrics.recordTender(true);
        events.publish(clock.instant(), EngineEventTypes.TENDER_ACCEPTED, Long.toString(offer.id()),
                new TenderDecisionEvent(offer.id(), offer.action().name(), offer.price(), offer.quantity(),
                        perShare, true, liquidated, liquidated ? "accepted after liquidation" : "accepted"));

        hedgeAcceptedTender(offer, base);
        return Optional.of(ledger.positions().orElse(base.positions().apply(hedgeLegs(offer))));
    }

    private void hedgeAcceptedTender(TenderOffer offer, CycleState state) {
        OrderSide componentSide = offer.action().opposite();
        hedger.hedge(Instrument.COMPONENT_A, componentSide, offer.quantity(), state.quote(Instrument.COMPONENT_A));
        hedger.hedge(Instrument.COMPONENT_B, componentSide, offer.quantity(), state.quote(Instrument.COMPONENT_B));
        if (Boolean.TRUE.equals(cfg.hedgeCurrency())) {
            long notional = Math.round(offer.quantity() * offer.price());
            hedger.hedge(Instrument.CURRENCY, offer.action().opposite(), notional, state.quote(Instrument.CURRENCY));
        }
    }

    /**
     * Expected positions after the tender and its component hedges, used when the venue
     * cannot be re-read.
     */
    private static List<OrderIntent> hedgeLegs(TenderOffer offer) {
        OrderSide componentSide = offer.action().opposite();
        return List.of(
                OrderIntent.market(Instrument.COMPOSITE, offer.action(), offer.quantity()),
                OrderIntent.market(Instrument.COMPONENT_A, componentSide, offer.quantity()),
                OrderIntent.market(Instrument.COMPONENT_B, componentSide, offer.quantity())
        );
    }

    OptionalDouble profitPerShare(TenderOffer offer, CycleState state) {
        Quote currency = state.quote(Instrument.CURRENCY);
        if (offer.action() == OrderSide.BUY) {
            OptionalDouble basketSale = basketPrice(OrderSide.SELL, offer.quantity(), state);
            if (basketSale.isEmpty()) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(buyProfit(basketSale.getAsDouble(), offer.price(), currency.ask()));
        }
        OptionalDouble basketCost = basketPrice(OrderSide.BUY, offer.quantity(), state);
        if (basketCost.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(sellProfit(basketCost.getAsDouble(), offer.price(), currency.bid()));
    }

    static double buyProfit(double syntheticSell, double price, double currencyAsk) {
        return syntheticSell - price * currencyAsk;
    }

    static double sellProfit(double syntheticBuy, double price, double currencyBid) {
        return price * currencyBid - syntheticBuy;
    }

    /**
     * Per-unit value of trading one basket on {@code side}: touch prices, or a depth walk
     * of each component book when enabled.
     */
    private OptionalDouble basketPrice(OrderSide side, long quantity, CycleState state) {
        if (!Boolean.TRUE.equals(cfg.depthWalkEnabled())) {
            Quote a = state.quote(Instrument.COMPONENT_A);
            Quote b = state.quote(Instrument.COMPONENT_B);
            return OptionalDouble.of(side == OrderSide.SELL ? a.bid() + b.bid() : a.ask() + b.ask());
        }
        OptionalDouble a = marketData.book(Instrument.COMPONENT_A)
                .map(book -> book.walk(side, quantity))
                .orElse(OptionalDouble.empty());
        OptionalDouble b = marketData.book(Instrument.COMPONENT_B)
                .map(book -> book.walk(side, quantity))
                .orElse(OptionalDouble.empty());
        if (a.isEmpty() || b.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(a.getAsDouble() + b.getAsDouble());
    }

    private void reject(TenderOffer offer, double perShare, String reason) {
        log.debug("TENDER: skipped {} {} {} @ {} profit/share={} ({})", offer.id(), offer.action(),
                offer.quantity(), offer.price(), perShare, reason);
        metrics.recordTender(false);
        events.publish(clock.instant(), EngineEventTypes.TENDER_REJECTED, Long.toString(offer.id()),
                new TenderDecisionEvent(offer.id(), offer.action().name(), offer.price(), offer.quantity(),
                        perShare, false, false, reason));
    }
}

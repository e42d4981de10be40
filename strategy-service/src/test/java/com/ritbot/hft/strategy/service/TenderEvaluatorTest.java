package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.events.EngineEventTypes;
import com.ritbot.hft.events.payload.TenderDecisionEvent;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.InstrumentTickers;
import com.ritbot.hft.market.Quote;
import com.ritbot.hft.rit.api.BookLevel;
import com.ritbot.hft.rit.api.OrderBook;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.rit.api.OrderStyle;
import com.ritbot.hft.rit.api.TenderOffer;
import com.ritbot.hft.strategy.RecordingEventPublisher;
import com.ritbot.hft.strategy.StubExchangeClient;
import com.ritbot.hft.strategy.StubExchangeClient.SubmittedOrder;
import com.ritbot.hft.strategy.metrics.StrategyMetricsService;
import com.ritbot.hft.strategy.model.CycleState;
import com.ritbot.hft.strategy.model.PositionSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.ritbot.hft.strategy.CycleStateFixtures.NOW;
import static com.ritbot.hft.strategy.CycleStateFixtures.positions;
import static com.ritbot.hft.strategy.CycleStateFixtures.quotes;
import static com.ritbot.hft.strategy.CycleStateFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for TenderEvaluator.
 *
 * Covers the per-share profit formulas, the margin gate, limiter interaction and the
 * post-acceptance hedges.
 */
class TenderEvaluatorTest {

    /** Basket costs 19.60 to buy; currency bid 1.349. */
    private static final Map<Instrument, Quote> QUOTES = quotes(
            new Quote(9.98, 10.00), new Quote(9.58, 9.60), new Quote(19.00, 19.05), new Quote(1.349, 1.351));

    private StubExchangeClient exchange;
    private RecordingEventPublisher events;
    private SimpleMeterRegistry meterRegistry;
    private StrategyMetricsService metrics;
    private Clock fixedClock;
    private ArbProperties properties;
    private InstrumentTickers tickers;
    private OrderRouter router;
    private UnwindController unwind;

    @BeforeEach
    void setUp() {
        fixedClock = Clock.fixed(NOW, ZoneId.of("UTC"));
        meterRegistry = new SimpleMeterRegistry();
        metrics = new StrategyMetricsService(meterRegistry);
        exchange = new StubExchangeClient();
        events = new RecordingEventPublisher();
        properties = ArbProperties.defaults();
        tickers = new InstrumentTickers(properties.instruments());
        router = new OrderRouter(exchange, tickers, properties.risk(), metrics);
        unwind = new UnwindController(properties.unwind(), properties.risk(), router, events, fixedClock, metrics);
    }

    @Test
    void shouldComputeSellTenderProfitInBaseCurrency() {
        // Given: We sell 2000 composite at 19.00 and buy the basket back at 19.60
        TenderOffer offer = new TenderOffer(7, "RITC", OrderSide.SELL, 19.00, 2_000);

        // When
        OptionalDouble profit = evaluator(tender(0.15, false, false)).profitPerShare(offer, state(PositionSnapshot.flat(), QUOTES));

        // Then: 19.00 * 1.349 - 19.60
        assertThat(profit).isPresent();
        assertThat(profit.getAsDouble()).isCloseTo(6.031, within(1e-6));
    }

    @Test
    void shouldComputeBuyTenderProfitAgainstCurrencyAsk() {
        assertThat(TenderEvaluator.buyProfit(19.50, 14.00, 1.351)).isCloseTo(19.50 - 14.00 * 1.351, within(1e-12));
        assertThat(TenderEvaluator.sellProfit(19.60, 19.00, 1.349)).isCloseTo(6.031, within(1e-9));
    }

    @Test
    void shouldAcceptProfitableTenderAndHedgeEveryLeg() {
        // Given
        exchange.addTender(new TenderOffer(7, "RITC", OrderSide.SELL, 19.00, 2_000));

        // When
        int accepted = evaluator(tender(0.15, false, false)).evaluate(state(PositionSnapshot.flat(), QUOTES));

        // Then: Components bought back, currency proceeds offset
        assertThat(accepted).isEqualTo(1);
        assertThat(exchange.getAcceptedTenders()).containsExactly(7L);
        assertThat(exchange.getSubmittedOrders()).containsExactly(
                new SubmittedOrder("BULL", OrderSide.BUY, 2_000, OrderStyle.MARKET, null),
                new SubmittedOrder("BEAR", OrderSide.BUY, 2_000, OrderStyle.MARKET, null),
                new SubmittedOrder("USD", OrderSide.BUY, 38_000, OrderStyle.MARKET, null)
        );
        assertThat(meterRegistry.counter("arb.tenders.accepted").count()).isEqualTo(1.0);

        TenderDecisionEvent payload = (TenderDecisionEvent) events.ofType(EngineEventTypes.TENDER_ACCEPTED).get(0).payload();
        assertThat(payload.accepted()).isTrue();
        assertThat(payload.liquidated()).isFalse();
        assertThat(payload.profitPerShare()).isCloseTo(6.031, within(1e-6));
    }

    @Test
    void shouldHedgeBuyTenderBySellingComponentsAndCurrency() {
        // Given: Basket sells for 19.56, we pay 14.00 * 1.351 for the composite
        exchange.addTender(new TenderOffer(8, "RITC", OrderSide.BUY, 14.00, 1_000));

        // When
        evaluator(tender(0.15, false, false)).evaluate(state(PositionSnapshot.flat(), QUOTES));

        // Then
        assertThat(exchange.getAcceptedTenders()).containsExactly(8L);
        assertThat(exchange.getSubmittedOrders()).containsExactly(
                new SubmittedOrder("BULL", OrderSide.SELL, 1_000, OrderStyle.MARKET, null),
                new SubmittedOrder("BEAR", OrderSide.SELL, 1_000, OrderStyle.MARKET, null),
                new SubmittedOrder("USD", OrderSide.SELL, 14_000, OrderStyle.MARKET, null)
        );
    }

    @Test
    void shouldRejectProfitEqualToMargin() {
        // Given: Profit exactly 0 with a zero margin
        Map<Instrument, Quote> quotes = quotes(
                new Quote(10.00, 10.02), new Quote(9.50, 9.52), new Quote(19.50, 19.55), new Quote(0.999, 1.000));
        exchange.addTender(new TenderOffer(9, "RITC", OrderSide.BUY, 19.50, 1_000));
        exchange.addTender(new TenderOffer(10, "RITC", OrderSide.BUY, 19.49, 1_000));

        // When
        int accepted = evaluator(tender(0.0, false, false)).evaluate(state(PositionSnapshot.flat(), quotes));

        // Then: Only the strictly profitable offer is taken
        assertThat(accepted).isEqualTo(1);
        assertThat(exchange.getAcceptedTenders()).containsExactly(10L);
        TenderDecisionEvent rejected = (TenderDecisionEvent) events.ofType(EngineEventTypes.TENDER_REJECTED).get(0).payload();
        assertThat(rejected.tenderId()).isEqualTo(9L);
        assertThat(rejected.reason()).isEqualTo("below margin");
    }

    @Test
    void shouldRejectWhenBookCannotAbsorbHedge() {
        // Given: Depth walk on and only 1000 offered on component A
        exchange.setBook(new OrderBook("BULL", List.of(new BookLevel(9.98, 5_000)), List.of(new BookLevel(10.00, 1_000))));
        exchange.setBook(new OrderBook("BEAR", List.of(new BookLevel(9.58, 5_000)), List.of(new BookLevel(9.60, 5_000))));
        exchange.addTender(new TenderOffer(11, "RITC", OrderSide.SELL, 19.00, 2_000));

        // When
        int accepted = evaluator(tender(0.15, true, false)).evaluate(state(PositionSnapshot.flat(), QUOTES));

        // Then
        assertThat(accepted).isZero();
        assertThat(exchange.getAcceptedTenders()).isEmpty();
        TenderDecisionEvent rejected = (TenderDecisionEvent) events.ofType(EngineEventTypes.TENDER_REJECTED).get(0).payload();
        assertThat(rejected.reason()).isEqualTo("insufficient depth");
    }

    @Test
    void shouldUseVolumeWeightedBasketCostWhenDepthWalkEnabled() {
        exchange.setBook(new OrderBook("BULL", List.of(), List.of(new BookLevel(10.00, 1_000), new BookLevel(10.10, 1_000))));
        exchange.setBook(new OrderBook("BEAR", List.of(), List.of(new BookLevel(9.60, 5_000))));
        TenderOffer offer = new TenderOffer(12, "RITC", OrderSide.SELL, 19.00, 2_000);

        OptionalDouble profit = evaluator(tender(0.15, true, false)).profitPerShare(offer, state(PositionSnapshot.flat(), QUOTES));

        assertThat(profit.getAsDouble()).isCloseTo(19.00 * 1.349 - (10.05 + 9.60), within(1e-9));
    }

    @Test
    void shouldRejectTenderThatBreachesLimits() {
        // Given: Net already at -200000; selling more composite pushes it past the band
        exchange.addTender(new TenderOffer(13, "RITC", OrderSide.SELL, 19.00, 2_000));

        // When
        int accepted = evaluator(tender(0.15, false, false)).evaluate(state(positions(-100_000, 0, 0, 0), QUOTES));

        // Then
        assertThat(accepted).isZero();
        assertThat(exchange.getAcceptedTenders()).isEmpty();
        assertThat(exchange.getSubmittedOrders()).isEmpty();
        assertThat(meterRegistry.counter("arb.tenders.rejected").count()).isEqualTo(1.0);
    }

    @Test
    void shouldFlattenBookBeforeAcceptingTenderAboveLiquidationMargin() {
        // Given: Same breach, liquidation enabled and 6.03 > 0.20
        exchange.addTender(new TenderOffer(14, "RITC", OrderSide.SELL, 19.00, 2_000));

        // When
        int accepted = evaluator(tender(0.15, false, true)).evaluate(state(positions(-100_000, 0, 0, 0), QUOTES));

        // Then: Short composite is bought back in ceiling-sized chunks, then the tender is accepted
        assertThat(accepted).isEqualTo(1);
        assertThat(exchange.ordersFor("RITC")).hasSize(10)
                .allMatch(o -> o.side() == OrderSide.BUY && o.quantity() == 10_000);
        assertThat(exchange.getAcceptedTenders()).containsExactly(14L);
        TenderDecisionEvent payload = (TenderDecisionEvent) events.ofType(EngineEventTypes.TENDER_ACCEPTED).get(0).payload();
        assertThat(payload.liquidated()).isTrue();
    }

    @Test
    void shouldRejectTenderWhenLiquidationIsNotAcknowledged() {
        // Given: Over the limits, liquidation enabled, composite close-outs rejected by the venue
        exchange.failAlways("RITC");
        exchange.addTender(new TenderOffer(14, "RITC", OrderSide.SELL, 19.00, 2_000));

        // When
        int accepted = evaluator(tender(0.15, false, true)).evaluate(state(positions(-100_000, 0, 0, 0), QUOTES));

        // Then: Only the rejected close-out went out; the tender is left alone and nothing is hedged
        assertThat(accepted).isZero();
        assertThat(exchange.getAcceptedTenders()).isEmpty();
        assertThat(exchange.getSubmittedOrders()).singleElement()
                .isEqualTo(new SubmittedOrder("RITC", OrderSide.BUY, 10_000, OrderStyle.MARKET, null));
        assertThat(events.ofType(EngineEventTypes.TENDER_ACCEPTED)).isEmpty();
        TenderDecisionEvent rejected = (TenderDecisionEvent) events.ofType(EngineEventTypes.TENDER_REJECTED).get(0).payload();
        assertThat(rejected.reason()).isEqualTo("liquidation incomplete");
        assertThat(rejected.liquidated()).isFalse();
    }

    @Test
    void shouldNotLiquidateForTenderThatExceedsLimitsOnFlatBook() {
        // Given: 160000 composite weighs 320000, above the 300000 gross limit even when flat
        exchange.addTender(new TenderOffer(18, "RITC", OrderSide.SELL, 19.00, 160_000));

        // When
        int accepted = evaluator(tender(0.15, false, true)).evaluate(state(positions(-100_000, 0, 0, 0), QUOTES));

        // Then
        assertThat(accepted).isZero();
        assertThat(exchange.getSubmittedOrders()).isEmpty();
        assertThat(exchange.getAcceptedTenders()).isEmpty();
        TenderDecisionEvent rejected = (TenderDecisionEvent) events.ofType(EngineEventTypes.TENDER_REJECTED).get(0).payload();
        assertThat(rejected.reason()).isEqualTo("limit");
    }

    @Test
    void shouldIgnoreTendersWhileUnwinding() {
        // Given: Gross 260000 is above the 255000 trigger
        CycleState crowded = state(positions(130_000, 0, 0, 0), QUOTES);
        unwind.update(crowded);
        exchange.addTender(new TenderOffer(15, "RITC", OrderSide.SELL, 19.00, 2_000));

        // When
        int accepted = evaluator(tender(0.15, false, false)).evaluate(crowded);

        // Then
        assertThat(unwind.isUnwinding()).isTrue();
        assertThat(accepted).isZero();
        assertThat(exchange.getAcceptedTenders()).isEmpty();
        assertThat(events.ofType(EngineEventTypes.TENDER_REJECTED)).isEmpty();
    }

    @Test
    void shouldSkipOffersOnOtherTickers() {
        exchange.addTender(new TenderOffer(16, "BULL", OrderSide.SELL, 10.00, 2_000));

        int accepted = evaluator(tender(0.15, false, false)).evaluate(state(PositionSnapshot.flat(), QUOTES));

        assertThat(accepted).isZero();
        assertThat(events.getEvents()).isEmpty();
    }

    @Test
    void shouldNotHedgeWhenAcceptanceFails() {
        exchange.setTenderAcceptResult(false);
        exchange.addTender(new TenderOffer(17, "RITC", OrderSide.SELL, 19.00, 2_000));

        int accepted = evaluator(tender(0.15, false, false)).evaluate(state(PositionSnapshot.flat(), QUOTES));

        assertThat(accepted).isZero();
        assertThat(exchange.getSubmittedOrders()).isEmpty();
        TenderDecisionEvent rejected = (TenderDecisionEvent) events.ofType(EngineEventTypes.TENDER_REJECTED).get(0).payload();
        assertThat(rejected.reason()).isEqualTo("accept failed");
    }

    private TenderEvaluator evaluator(ArbProperties.Tender cfg) {
        HedgeExecutor hedger = new HedgeExecutor(router, properties.hedge(), d -> { }, events, fixedClock, metrics);
        return new TenderEvaluator(
                new MarketDataGateway(exchange, tickers),
                new PositionLedger(exchange, tickers),
                new RiskLimiter(properties.risk()),
                router,
                hedger,
                unwind,
                tickers,
                cfg,
                events,
                fixedClock,
                metrics
        );
    }

    private static ArbProperties.Tender tender(double margin, boolean depthWalk, boolean liquidation) {
        return new ArbProperties.Tender(true, margin, depthWalk, liquidation, 0.20, true);
    }
}

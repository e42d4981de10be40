package com.ritbot.hft.strategy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.events.EngineEventPublisher;
import com.ritbot.hft.market.InstrumentTickers;
import com.ritbot.hft.rit.client.ExchangeClient;
import com.ritbot.hft.rit.client.RitExchangeClient;
import com.ritbot.hft.rit.http.ExchangeHttpTransport;
import com.ritbot.hft.rit.http.HttpRequestFactory;
import com.ritbot.hft.rit.http.MinIntervalRateLimiter;
import com.ritbot.hft.rit.http.RequestRateLimiter;
import com.ritbot.hft.strategy.metrics.StrategyMetricsService;
import com.ritbot.hft.strategy.service.ArbitrageExecutor;
import com.ritbot.hft.strategy.service.ConverterAdvisor;
import com.ritbot.hft.strategy.service.CurrencyRebalancer;
import com.ritbot.hft.strategy.service.DeltaHedgeMonitor;
import com.ritbot.hft.strategy.service.EdgeCalculator;
import com.ritbot.hft.strategy.service.HedgeExecutor;
import com.ritbot.hft.strategy.service.MarketDataGateway;
import com.ritbot.hft.strategy.service.OrderRouter;
import com.ritbot.hft.strategy.service.PositionLedger;
import com.ritbot.hft.strategy.service.RiskLimiter;
import com.ritbot.hft.strategy.service.SizingPolicy;
import com.ritbot.hft.strategy.service.TenderEvaluator;
import com.ritbot.hft.strategy.service.UnwindController;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the venue client and the engine components from {@link ArbProperties}.
 */
@Slf4j
@Configuration
public class StrategyConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InstrumentTickers instrumentTickers(ArbProperties properties) {
        return new InstrumentTickers(properties.instruments());
    }

    @Bean
    public HttpClient ritHttpClient(ArbProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.venue().timeoutMillis()))
                .build();
    }

    @Bean
    public ExchangeHttpTransport exchangeHttpTransport(ArbProperties properties, HttpClient ritHttpClient,
                                                       ObjectMapper objectMapper) {
        return new ExchangeHttpTransport(ritHttpClient, objectMapper, buildRateLimiter(properties.venue()));
    }

    @Bean
    public ExchangeClient exchangeClient(ArbProperties properties, ExchangeHttpTransport transport) {
        ArbProperties.Venue venue = properties.venue();
        if (venue.apiKey().isBlank()) {
            log.warn("arb.venue.api-key is blank; the venue will reject authenticated calls");
        }
        log.info("RIT venue {} (timeoutMillis={}, bookDepth={})", venue.baseUrl(), venue.timeoutMillis(), venue.bookDepth());
        return new RitExchangeClient(
                new HttpRequestFactory(URI.create(venue.baseUrl()), venue.apiKey()),
                transport,
                Duration.ofMillis(venue.timeoutMillis()),
                venue.bookDepth()
        );
    }

    @Bean
    public MarketDataGateway marketDataGateway(ExchangeClient exchangeClient, InstrumentTickers tickers) {
        return new MarketDataGateway(exchangeClient, tickers);
    }

    @Bean
    public PositionLedger positionLedger(ExchangeClient exchangeClient, InstrumentTickers tickers) {
        return new PositionLedger(exchangeClient, tickers);
    }

    @Bean
    public RiskLimiter riskLimiter(ArbProperties properties) {
        return new RiskLimiter(properties.risk());
    }

    @Bean
    public EdgeCalculator edgeCalculator() {
        return new EdgeCalculator();
    }

    @Bean
    public SizingPolicy sizingPolicy(ArbProperties properties) {
        return new SizingPolicy(properties.arbitrage().tiers());
    }

    @Bean
    public OrderRouter orderRouter(ExchangeClient exchangeClient, InstrumentTickers tickers, ArbProperties properties,
                                   StrategyMetricsService metrics) {
        return new OrderRouter(exchangeClient, tickers, properties.risk(), metrics);
    }

    @Bean
    public HedgeExecutor hedgeExecutor(OrderRouter router, ArbProperties properties, EngineEventPublisher events,
                                       Clock clock, StrategyMetricsService metrics) {
        return new HedgeExecutor(router, properties.hedge(), events, clock, metrics);
    }

    @Bean
    public UnwindController unwindController(ArbProperties properties, OrderRouter router, EngineEventPublisher events,
                                             Clock clock, StrategyMetricsService metrics) {
        return new UnwindController(properties.unwind(), properties.risk(), router, events, clock, metrics);
    }

    @Bean
    public ArbitrageExecutor arbitrageExecutor(EdgeCalculator edges, SizingPolicy sizing, RiskLimiter limiter,
                                               OrderRouter router, HedgeExecutor hedger, ArbProperties properties,
                                               EngineEventPublisher events, Clock clock,
                                               StrategyMetricsService metrics) {
        return new ArbitrageExecutor(edges, sizing, limiter, router, hedger, properties.arbitrage(), events, clock, metrics);
    }

    @Bean
    public TenderEvaluator tenderEvaluator(MarketDataGateway marketData, PositionLedger ledger, RiskLimiter limiter,
                                           OrderRouter router, HedgeExecutor hedger, UnwindController unwind,
                                           InstrumentTickers tickers, ArbProperties properties,
                                           EngineEventPublisher events, Clock clock,
                                           StrategyMetricsService metrics) {
        return new TenderEvaluator(marketData, ledger, limiter, router, hedger, unwind, tickers, properties.tender(),
                events, clock, metrics);
    }

    @Bean
    public CurrencyRebalancer currencyRebalancer(OrderRouter router, ArbProperties properties,
                                                 StrategyMetricsService metrics) {
        return new CurrencyRebalancer(router, properties.rebalance(), metrics);
    }

    @Bean
    public DeltaHedgeMonitor deltaHedgeMonitor(HedgeExecutor hedger, RiskLimiter limiter, OrderRouter router,
                                               ArbProperties properties) {
        return new DeltaHedgeMonitor(hedger, limiter, router, properties.deltaHedge());
    }

    @Bean
    public ConverterAdvisor converterAdvisor(ArbProperties properties, EngineEventPublisher events, Clock clock) {
        return new ConverterAdvisor(properties.converter(), properties.risk(), events, clock);
    }

    private static RequestRateLimiter buildRateLimiter(ArbProperties.Venue venue) {
        if (venue.minRequestIntervalMillis() <= 0) {
            return RequestRateLimiter.noop();
        }
        return new MinIntervalRateLimiter(Duration.ofMillis(venue.minRequestIntervalMillis()));
    }
}

package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.InstrumentTickers;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.rit.api.OrderStyle;
import com.ritbot.hft.rit.client.ExchangeClient;
import com.ritbot.hft.rit.client.ExchangeException;
import com.ritbot.hft.strategy.StubExchangeClient;
import com.ritbot.hft.strategy.StubExchangeClient.SubmittedOrder;
import com.ritbot.hft.strategy.metrics.StrategyMetricsService;
import com.ritbot.hft.strategy.model.OrderIntent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OrderRouterTest {

    private StubExchangeClient exchange;
    private SimpleMeterRegistry meterRegistry;
    private OrderRouter router;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        exchange = new StubExchangeClient();
        ArbProperties properties = ArbProperties.defaults();
        router = new OrderRouter(exchange, new InstrumentTickers(properties.instruments()), properties.risk(),
                new StrategyMetricsService(meterRegistry));
    }

    @Test
    void shouldUseSeparateCeilingForCurrency() {
        assertThat(router.chunks(Instrument.COMPOSITE, 25_000)).containsExactly(10_000L, 10_000L, 5_000L);
        assertThat(router.chunks(Instrument.CURRENCY, 3_000_000)).containsExactly(2_500_000L, 500_000L);
        assertThat(router.chunks(Instrument.COMPONENT_A, 0)).isEmpty();
    }

    @Test
    void shouldStopChunkingAtFirstRejection() {
        // Given: Venue rejects the composite
        exchange.failAlways("RITC");

        // When
        long acknowledged = router.submit(OrderIntent.market(Instrument.COMPOSITE, OrderSide.BUY, 25_000));

        // Then: Remaining chunks are not sent
        assertThat(acknowledged).isZero();
        assertThat(exchange.getSubmittedOrders()).hasSize(1);
        assertThat(meterRegistry.counter("arb.orders.failed", "instrument", "COMPOSITE").count()).isEqualTo(1.0);
    }

    @Test
    void shouldReportAcknowledgedQuantity() {
        long acknowledged = router.submit(OrderIntent.limit(Instrument.COMPONENT_B, OrderSide.SELL, 12_000, 9.55));

        assertThat(acknowledged).isEqualTo(12_000L);
        assertThat(exchange.getSubmittedOrders()).containsExactly(
                new SubmittedOrder("BEAR", OrderSide.SELL, 10_000, OrderStyle.LIMIT, 9.55),
                new SubmittedOrder("BEAR", OrderSide.SELL, 2_000, OrderStyle.LIMIT, 9.55));
        assertThat(meterRegistry.counter("arb.orders.submitted", "instrument", "COMPONENT_B").count()).isEqualTo(2.0);
    }

    @Test
    void shouldTreatClientExceptionAsNotExecuted() {
        // Given: Transport failure from the venue client
        ExchangeClient failing = mock(ExchangeClient.class);
        when(failing.submitOrder(anyString(), any(), anyLong(), any(), any()))
                .thenThrow(ExchangeException.transientFailure("POST /orders", null));
        when(failing.acceptTender(anyLong())).thenThrow(ExchangeException.transientFailure("POST /tenders", null));
        OrderRouter failingRouter = new OrderRouter(failing, new InstrumentTickers(ArbProperties.defaults().instruments()),
                ArbProperties.defaults().risk(), new StrategyMetricsService(meterRegistry));

        // Then
        assertThat(failingRouter.submitOnce(OrderIntent.market(Instrument.COMPONENT_A, OrderSide.BUY, 100))).isFalse();
        assertThat(failingRouter.acceptTender(5)).isFalse();
    }

    @Test
    void shouldNotSendEmptyOrders() {
        assertThat(router.submitOnce(OrderIntent.market(Instrument.COMPONENT_A, OrderSide.BUY, 0))).isFalse();
        assertThat(exchange.getSubmittedOrders()).isEmpty();
    }
}

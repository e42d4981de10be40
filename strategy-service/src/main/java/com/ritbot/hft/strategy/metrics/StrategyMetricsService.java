package com.ritbot.hft.strategy.metrics;

import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.strategy.model.ExposureSnapshot;
import com.ritbot.hft.strategy.model.UnwindState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer counters and gauges for the arbitrage engine.
 */
@Service
public class StrategyMetricsService {

    private final MeterRegistry registry;

    private final Counter cycles;
    private final Counter cyclesSkipped;
    private final Counter hedgeRetries;
    private final Counter hedgeExhausted;
    private final Counter tendersAccepted;
    private final Counter tendersRejected;
    private final Counter arbitrageTrades;
    private final Counter currencyRebalances;
    private final Counter unwindOrders;

    private final AtomicLong grossExposure = new AtomicLong();
    private final AtomicLong netExposure = new AtomicLong();
    private final AtomicLong unwinding = new AtomicLong();
    private final AtomicLong lastTick = new AtomicLong();

    public StrategyMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cycles = Counter.builder("arb.cycles").description("Engine iterations that reached trading logic").register(registry);
        this.cyclesSkipped = Counter.builder("arb.cycles.skipped").description("Iterations skipped for missing venue data").register(registry);
        this.hedgeRetries = Counter.builder("arb.hedge.retries").register(registry);
        this.hedgeExhausted = Counter.builder("arb.hedge.exhausted")
                .description("Hedge chunks that exhausted their retry budget")
                .register(registry);
        this.tendersAccepted = Counter.builder("arb.tenders.accepted").register(registry);
        this.tendersRejected = Counter.builder("arb.tenders.rejected").register(registry);
        this.arbitrageTrades = Counter.builder("arb.arbitrage.trades").register(registry);
        this.currencyRebalances = Counter.builder("arb.currency.rebalances").register(registry);
        this.unwindOrders = Counter.builder("arb.unwind.orders").register(registry);

        registry.gauge("arb.exposure.gross", grossExposure);
        registry.gauge("arb.exposure.net", netExposure);
        registry.gauge("arb.unwind.active", unwinding);
        registry.gauge("arb.case.tick", lastTick);
    }

    public void recordOrder(Instrument instrument, boolean accepted) {
        registry.counter(accepted ? "arb.orders.submitted" : "arb.orders.failed",
                "instrument", instrument.name()).increment();
    }

    public void recordCycle(int tick) {
        cycles.increment();
        lastTick.set(tick);
    }

    public void recordSkippedCycle() {
        cyclesSkipped.increment();
    }

    public void recordExposure(ExposureSnapshot exposure, UnwindState state) {
        grossExposure.set(exposure.gross());
        netExposure.set(exposure.net());
        unwinding.set(state == UnwindState.UNWINDING ? 1 : 0);
    }

    public void recordHedgeRetry() {
        hedgeRetries.increment();
    }

    public void recordHedgeExhausted() {
        hedgeExhausted.increment();
    }

    public void recordTender(boolean accepted) {
        (accepted ? tendersAccepted : tendersRejected).increment();
    }

    public void recordArbitrageTrade() {
        arbitrageTrades.increment();
    }

    public void recordCurrencyRebalance() {
        currencyRebalances.increment();
    }

    public void recordUnwindOrders(int count) {
        if (count > 0) {
            unwindOrders.increment(count);
        }
    }
}

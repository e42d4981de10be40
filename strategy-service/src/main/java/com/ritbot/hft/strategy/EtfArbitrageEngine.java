package com.ritbot.hft.strategy;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.events.EngineEventPublisher;
import com.ritbot.hft.events.EngineEventTypes;
import com.ritbot.hft.rit.api.TickStatus;
import com.ritbot.hft.strategy.metrics.StrategyMetricsService;
import com.ritbot.hft.strategy.model.ArbitrageOutcome;
import com.ritbot.hft.strategy.model.CycleState;
import com.ritbot.hft.strategy.model.PositionSnapshot;
import com.ritbot.hft.strategy.service.ArbitrageExecutor;
import com.ritbot.hft.strategy.service.ConverterAdvisor;
import com.ritbot.hft.strategy.service.CurrencyRebalancer;
import com.ritbot.hft.strategy.service.DeltaHedgeMonitor;
import com.ritbot.hft.strategy.service.MarketDataGateway;
import com.ritbot.hft.strategy.service.PositionLedger;
import com.ritbot.hft.strategy.service.TenderEvaluator;
import com.ritbot.hft.strategy.service.UnwindController;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Control loop for the ETF arbitrage strategy.
 *
 * Each iteration reads the case status, positions and quotes once, then runs in order:
 * delta-hedge check, tender evaluation, new arbitrage, currency rebalancing and the unwind
 * check. Positions are re-read after any stage that sent orders.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EtfArbitrageEngine {

    private final @NonNull ArbProperties properties;
    private final @NonNull MarketDataGateway marketData;
    private final @NonNull PositionLedger ledger;
    private final @NonNull DeltaHedgeMonitor deltaHedge;
    private final @NonNull TenderEvaluator tenders;
    private final @NonNull ArbitrageExecutor arbitrage;
    private final @NonNull CurrencyRebalancer rebalancer;
    private final @NonNull UnwindController unwind;
    private final @NonNull ConverterAdvisor converter;
    private final @NonNull EngineEventPublisher events;
    private final @NonNull Clock clock;
    private final @NonNull StrategyMetricsService metrics;

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "etf-arbitrage");
        t.setDaemon(true);
        return t;
    });

    private final AtomicBoolean caseSeenActive = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicReference<TickStatus> lastStatus = new AtomicReference<>(TickStatus.unreachable());
    private final AtomicReference<CycleState> lastState = new AtomicReference<>();

    @PostConstruct
    void startIfEnabled() {
        ArbProperties.Engine cfg = properties.engine();
        log.info("etf-arbitrage config loaded (enabled={}, refreshMillis={}, grossLimit={}, netLimit={}, edgeThreshold={}, tenderMargin={})",
                cfg.enabled(), cfg.refreshMillis(), properties.risk().grossLimit(), properties.risk().netLimit(),
                properties.arbitrage().edgeThreshold(), properties.tender().margin());

        if (!cfg.enabled()) {
            log.info("etf-arbitrage engine is disabled");
            return;
        }

        long delayMs = Math.max(10, cfg.refreshMillis());
        executor.scheduleWithFixedDelay(this::safeTick, 0, delayMs, TimeUnit.MILLISECONDS);
        started.set(true);
        log.info("etf-arbitrage started (refreshMillis={})", delayMs);
    }

    public boolean isRunning() {
        return started.get() && !executor.isShutdown();
    }

    public TickStatus lastStatus() {
        return lastStatus.get();
    }

    public Optional<CycleState> lastState() {
        return Optional.ofNullable(lastState.get());
    }

    @PreDestroy
    void shutdown() {
        log.info("etf-arbitrage shutting down");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("etf-arbitrage iteration still running after 5s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void safeTick() {
        try {
            runCycle();
        } catch (Exception e) {
            log.error("ETF-ARB: Tick failed, continuing scheduler loop", e);
        }
    }

    /**
     * One loop iteration.
     *
     * @return true when the trading stages ran
     */
    public boolean runCycle() {
        TickStatus status = marketData.tickStatus();
        lastStatus.set(status);

        if (status.isActive()) {
            caseSeenActive.set(true);
        } else {
            if (status.isStopped() && caseSeenActive.get() && properties.engine().stopOnCaseEnd()) {
                onCaseEnded(status);
            } else {
                log.debug("case not active (tick={}, status={}, reachable={})",
                        status.tick(), status.status(), status.reachable());
            }
            return false;
        }

        Optional<PositionSnapshot> positions = ledger.positions();
        if (positions.isEmpty()) {
            log.debug("positions unavailable at tick {}, skipping cycle", status.tick());
            metrics.recordSkippedCycle();
            return false;
        }
        CycleState state = new CycleState(clock.instant(), status, positions.get(), marketData.quotes());
        metrics.recordCycle(status.tick());

        if (deltaHedge.check(state) > 0) {
            state = refreshPositions(state);
        }
        if (tenders.evaluate(state) > 0) {
            state = refreshPositions(state);
        }
        ArbitrageOutcome outcome = arbitrage.run(state, unwind.isUnwinding());
        if (outcome.traded()) {
            state = refreshPositions(state);
        }
        if (rebalancer.rebalance(state)) {
            state = refreshPositions(state);
        }
        unwind.update(state);
        unwind.step(state);
        converter.advise(state);

        metrics.recordExposure(state.positions().exposure(), unwind.state());
        lastState.set(state);
        return true;
    }

    private CycleState refreshPositions(CycleState state) {
        return ledger.positions().map(state::withPositions).orElse(state);
    }

    private void onCaseEnded(TickStatus status) {
        if (!caseSeenActive.compareAndSet(true, false)) {
            return;
        }
        log.info("case stopped at tick {}, stopping etf-arbitrage loop", status.tick());
        events.publish(clock.instant(), EngineEventTypes.CASE_STOPPED, Integer.toString(status.tick()),
                Map.of("tick", status.tick()));
        executor.shutdown();
    }
}

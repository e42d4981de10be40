package com.ritbot.hft.strategy.web;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.rit.api.CaseStatus;
import com.ritbot.hft.rit.api.TickStatus;
import com.ritbot.hft.strategy.EtfArbitrageEngine;
import com.ritbot.hft.strategy.model.ArbitrageOutcome;
import com.ritbot.hft.strategy.model.ArbitrageStage;
import com.ritbot.hft.strategy.model.CycleState;
import com.ritbot.hft.strategy.model.UnwindState;
import com.ritbot.hft.strategy.service.ArbitrageExecutor;
import com.ritbot.hft.strategy.service.UnwindController;
import com.ritbot.hft.strategy.web.StrategyStatusController.StrategyStatusResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static com.ritbot.hft.strategy.CycleStateFixtures.positions;
import static com.ritbot.hft.strategy.CycleStateFixtures.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StrategyStatusControllerTest {

    @Mock
    private EtfArbitrageEngine engine;

    @Mock
    private UnwindController unwind;

    @Mock
    private ArbitrageExecutor arbitrage;

    @Test
    void shouldReportLastCycleExposureAndState() {
        // Given
        CycleState last = state(88, positions(10_000, -10_000, -9_000, 0), Map.of());
        when(engine.lastStatus()).thenReturn(TickStatus.of(88, CaseStatus.ACTIVE));
        when(engine.lastState()).thenReturn(Optional.of(last));
        when(engine.isRunning()).thenReturn(true);
        when(unwind.state()).thenReturn(UnwindState.NORMAL);
        when(arbitrage.lastOutcome()).thenReturn(ArbitrageOutcome.idle(ArbitrageStage.EVALUATE, "no edge"));
        StrategyStatusController controller = new StrategyStatusController(ArbProperties.defaults(), engine, unwind, arbitrage);

        // When
        StrategyStatusResponse response = controller.status().getBody();

        // Then
        assertThat(response).isNotNull();
        assertThat(response.engineRunning()).isTrue();
        assertThat(response.tick()).isEqualTo(88);
        assertThat(response.caseStatus()).isEqualTo("ACTIVE");
        assertThat(response.grossExposure()).isEqualTo(39_000L);
        assertThat(response.netExposure()).isEqualTo(1_000L);
        assertThat(response.grossLimit()).isEqualTo(300_000L);
        assertThat(response.lastArbitrageStage()).isEqualTo("EVALUATE");
        assertThat(response.lastArbitrageReason()).isEqualTo("no edge");
    }

    @Test
    void shouldReportZeroExposureBeforeFirstCycle() {
        when(engine.lastStatus()).thenReturn(TickStatus.unreachable());
        when(engine.lastState()).thenReturn(Optional.empty());
        when(unwind.state()).thenReturn(UnwindState.NORMAL);
        when(arbitrage.lastOutcome()).thenReturn(ArbitrageOutcome.idle(ArbitrageStage.IDLE, "not run"));
        StrategyStatusController controller = new StrategyStatusController(ArbProperties.defaults(), engine, unwind, arbitrage);

        StrategyStatusResponse response = controller.status().getBody();

        assertThat(response.venueReachable()).isFalse();
        assertThat(response.grossExposure()).isZero();
        assertThat(response.engineEnabled()).isFalse();
    }
}

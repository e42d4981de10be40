package com.ritbot.hft.strategy.web;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.rit.api.TickStatus;
import com.ritbot.hft.strategy.EtfArbitrageEngine;
import com.ritbot.hft.strategy.model.ArbitrageOutcome;
import com.ritbot.hft.strategy.model.CycleState;
import com.ritbot.hft.strategy.model.ExposureSnapshot;
import com.ritbot.hft.strategy.model.PositionSnapshot;
import com.ritbot.hft.strategy.service.ArbitrageExecutor;
import com.ritbot.hft.strategy.service.UnwindController;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/strategy")
@RequiredArgsConstructor
public class StrategyStatusController {

  private final @NonNull ArbProperties properties;
  private final @NonNull EtfArbitrageEngine engine;
  private final @NonNull UnwindController unwind;
  private final @NonNull ArbitrageExecutor arbitrage;

  @GetMapping("/status")
  public ResponseEntity<StrategyStatusResponse> status() {
    TickStatus status = engine.lastStatus();
    ExposureSnapshot exposure = engine.lastState()
        .map(CycleState::positions)
        .map(PositionSnapshot::exposure)
        .orElse(new ExposureSnapshot(0, 0));
    ArbitrageOutcome last = arbitrage.lastOutcome();
    return ResponseEntity.ok(new StrategyStatusResponse(
        properties.engine().enabled(),
        engine.isRunning(),
        properties.venue().baseUrl(),
        status.tick(),
        status.status().name(),
        status.reachable(),
        unwind.state().name(),
        exposure.gross(),
        exposure.net(),
        properties.risk().grossLimit(),
        properties.risk().netLimit(),
        last.stage().name(),
        last.reason()
    ));
  }

  public record StrategyStatusResponse(
      boolean engineEnabled,
      boolean engineRunning,
      String venueBaseUrl,
      int tick,
      String caseStatus,
      boolean venueReachable,
      String unwindState,
      long grossExposure,
      long netExposure,
      long grossLimit,
      long netLimit,
      String lastArbitrageStage,
      String lastArbitrageReason
  ) {
  }
}

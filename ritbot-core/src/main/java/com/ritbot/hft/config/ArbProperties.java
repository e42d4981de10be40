package com.ritbot.hft.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix="arb")
public record ArbProperties(
    @Valid Venue venue,
    @Valid Instruments instruments,
    @Valid Risk risk,
    @Valid Arbitrage arbitrage,
    @Valid Tender tender,
    @Valid Hedge hedge,
    @Valid Rebalance rebalance,
    @Valid Unwind unwind,
    @Valid DeltaHedge deltaHedge,
    @Valid Converter converter,
    @Valid Engine engine
) {

  public ArbProperties {
    if (venue == null) {
      venue = new Venue(null, null, null, null, null);
    }
    if (instruments == null) {
      instruments = new Instruments(null, null, null, null, null);
    }
    if (risk == null) {
      risk = new Risk(null, null, null, null, null, null);
    }
    if (arbitrage == null) {
      arbitrage = new Arbitrage(null, null, null);
    }
    if (tender == null) {
      tender = new Tender(null, null, null, null, null, null);
    }
    if (hedge == null) {
      hedge = new Hedge(null, null, null, null, null);
    }
    if (rebalance == null) {
      rebalance = new Rebalance(null, null, null);
    }
    if (unwind == null) {
      unwind = new Unwind(null, null, null, null, null, null);
    }
    if (deltaHedge == null) {
      deltaHedge = new DeltaHedge(null, null);
    }
    if (converter == null) {
      converter = new Converter(null, null, null, null);
    }
    if (engine == null) {
      engine = new Engine(null, null, null);
    }
  }

  public static ArbProperties defaults() {
    return new ArbProperties(null, null, null, null, null, null, null, null, null, null, null);
  }

  private static List<SizeTier> sanitizeTiers(List<SizeTier> tiers) {
    if (tiers == null || tiers.isEmpty()) {
      return defaultTiers();
    }
    List<SizeTier> cleaned = tiers.stream()
        .filter(Objects::nonNull)
        .filter(t -> t.minEdge() != null && t.quantity() != null)
        .sorted(Comparator.comparingDouble(SizeTier::minEdge))
        .toList();
    return cleaned.isEmpty() ? defaultTiers() : cleaned;
  }

  private static List<SizeTier> defaultTiers() {
    return List.of(
        new SizeTier(0.05, 1_000L),
        new SizeTier(0.10, 2_500L),
        new SizeTier(0.20, 5_000L),
        new SizeTier(0.30, 10_000L)
    );
  }

  /**
   * Connection to the exchange simulator REST API.
   */
  public record Venue(
      String baseUrl,
      String apiKey,
      @Min(1) Long timeoutMillis,
      @PositiveOrZero Long minRequestIntervalMillis,
      @Min(1) Integer bookDepth
  ) {
    public Venue {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "http://localhost:9999/v1";
      }
      if (apiKey == null) {
        apiKey = "";
      }
      if (timeoutMillis == null) {
        timeoutMillis = 2_000L;
      }
      if (minRequestIntervalMillis == null) {
        minRequestIntervalMillis = 0L;
      }
      if (bookDepth == null) {
        bookDepth = 20;
      }
    }
  }

  /**
   * Venue tickers for each instrument role.
   */
  public record Instruments(
      String componentA,
      String componentB,
      String composite,
      String currency,
      String baseCurrency
  ) {
    public Instruments {
      componentA = tickerOrDefault(componentA, "BULL");
      componentB = tickerOrDefault(componentB, "BEAR");
      composite = tickerOrDefault(composite, "RITC");
      currency = tickerOrDefault(currency, "USD");
      baseCurrency = tickerOrDefault(baseCurrency, "CAD");
    }

    private static String tickerOrDefault(String value, String fallback) {
      return value == null || value.isBlank() ? fallback : value.trim().toUpperCase(Locale.ROOT);
    }
  }

  public record Risk(
      @Min(1) Long grossLimit,
      @Min(1) Long netLimit,
      @NotNull Boolean cashCheckEnabled,
      @DecimalMin("1.0") Double cashLimit,
      @Min(1) Long maxOrderSize,
      @Min(1) Long maxCurrencyOrderSize
  ) {
    public Risk {
      if (grossLimit == null) {
        grossLimit = 300_000L;
      }
      if (netLimit == null) {
        netLimit = 200_000L;
      }
      if (cashCheckEnabled == null) {
        cashCheckEnabled = false;
      }
      if (cashLimit == null) {
        cashLimit = 10_000_000.0;
      }
      if (maxOrderSize == null) {
        maxOrderSize = 10_000L;
      }
      if (maxCurrencyOrderSize == null) {
        maxCurrencyOrderSize = 2_500_000L;
      }
    }
  }

  public record Arbitrage(
      @NotNull Boolean enabled,
      @PositiveOrZero Double edgeThreshold,
      @Size(min = 4) List<@Valid SizeTier> tiers
  ) {
    public Arbitrage {
      if (enabled == null) {
        enabled = true;
      }
      if (edgeThreshold == null) {
        edgeThreshold = 0.05;
      }
      tiers = sanitizeTiers(tiers);
    }
  }

  /**
   * One row of the sizing table: edges at or above {@code minEdge} trade {@code quantity} units.
   */
  public record SizeTier(
      @PositiveOrZero Double minEdge,
      @PositiveOrZero Long quantity
  ) {
  }

  public record Tender(
      @NotNull Boolean enabled,
      @PositiveOrZero Double margin,
      @NotNull Boolean depthWalkEnabled,
      @NotNull Boolean liquidationEnabled,
      @PositiveOrZero Double liquidationMargin,
      @NotNull Boolean hedgeCurrency
  ) {
    public Tender {
      if (enabled == null) {
        enabled = true;
      }
      if (margin == null) {
        margin = 0.15;
      }
      if (depthWalkEnabled == null) {
        depthWalkEnabled = false;
      }
      if (liquidationEnabled == null) {
        liquidationEnabled = false;
      }
      if (liquidationMargin == null) {
        liquidationMargin = 0.20;
      }
      if (hedgeCurrency == null) {
        hedgeCurrency = true;
      }
    }
  }

  public record Hedge(
      @Min(1) Integer maxAttempts,
      @PositiveOrZero Long initialBackoffMillis,
      @PositiveOrZero Long maxBackoffMillis,
      @DecimalMin("1.0") Double backoffMultiplier,
      @NotNull Boolean passiveFirst
  ) {
    public Hedge {
      if (maxAttempts == null) {
        maxAttempts = 5;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 50L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 400L;
      }
      if (backoffMultiplier == null) {
        backoffMultiplier = 2.0;
      }
      if (passiveFirst == null) {
        passiveFirst = false;
      }
    }
  }

  public record Rebalance(
      @NotNull Boolean enabled,
      @Min(1) Long driftTolerance,
      @PositiveOrZero Long minCompositePosition
  ) {
    public Rebalance {
      if (enabled == null) {
        enabled = true;
      }
      if (driftTolerance == null) {
        driftTolerance = 2_000L;
      }
      if (minCompositePosition == null) {
        minCompositePosition = 0L;
      }
    }
  }

  public record Unwind(
      @NotNull Boolean enabled,
      @DecimalMin("0.0") @DecimalMax("1.0") Double trigger,
      @Min(1) Long chunkSize,
      @PositiveOrZero Long aggressiveThreshold,
      @PositiveOrZero Double limitOffset,
      @PositiveOrZero Long minResidual
  ) {
    public Unwind {
      if (enabled == null) {
        enabled = true;
      }
      if (trigger == null) {
        trigger = 0.85;
      }
      if (chunkSize == null) {
        chunkSize = 1_000L;
      }
      if (aggressiveThreshold == null) {
        aggressiveThreshold = 2_000L;
      }
      if (limitOffset == null) {
        limitOffset = 0.01;
      }
      if (minResidual == null) {
        minResidual = 500L;
      }
    }
  }

  /**
   * Component-vs-composite delta check run before any new risk is taken.
   */
  public record DeltaHedge(
      @NotNull Boolean enabled,
      @PositiveOrZero Long componentThreshold
  ) {
    public DeltaHedge {
      if (enabled == null) {
        enabled = true;
      }
      if (componentThreshold == null) {
        componentThreshold = 1_500L;
      }
    }
  }

  /**
   * Creation/redemption advisories. The engine never calls the converter itself.
   */
  public record Converter(
      @NotNull Boolean enabled,
      @Min(1) Long blockSize,
      @PositiveOrZero Double costPerConversion,
      @Min(1) Integer adviceEveryTicks
  ) {
    public Converter {
      if (enabled == null) {
        enabled = true;
      }
      if (blockSize == null) {
        blockSize = 10_000L;
      }
      if (costPerConversion == null) {
        costPerConversion = 1_500.0;
      }
      if (adviceEveryTicks == null) {
        adviceEveryTicks = 10;
      }
    }
  }

  public record Engine(
      @NotNull Boolean enabled,
      @Min(10) Long refreshMillis,
      @NotNull Boolean stopOnCaseEnd
  ) {
    public Engine {
      if (enabled == null) {
        enabled = false;
      }
      if (refreshMillis == null) {
        refreshMillis = 200L;
      }
      if (stopOnCaseEnd == null) {
        stopOnCaseEnd = true;
      }
    }
  }
}

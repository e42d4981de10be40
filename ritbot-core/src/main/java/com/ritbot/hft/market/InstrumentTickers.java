package com.ritbot.hft.market;

import com.ritbot.hft.config.ArbProperties;
import lombok.NonNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps instrument roles to venue tickers and back.
 */
public final class InstrumentTickers {

  private final Map<Instrument, String> tickerByInstrument;
  private final Map<String, Instrument> instrumentByTicker;
  private final String baseCurrency;

  public InstrumentTickers(@NonNull ArbProperties.Instruments cfg) {
    EnumMap<Instrument, String> tickers = new EnumMap<>(Instrument.class);
    tickers.put(Instrument.COMPONENT_A, cfg.componentA());
    tickers.put(Instrument.COMPONENT_B, cfg.componentB());
    tickers.put(Instrument.COMPOSITE, cfg.composite());
    tickers.put(Instrument.CURRENCY, cfg.currency());

    Map<String, Instrument> reverse = new HashMap<>();
    tickers.forEach((instrument, ticker) -> {
      Instrument previous = reverse.put(ticker, instrument);
      if (previous != null) {
        throw new IllegalArgumentException("ticker %s mapped to both %s and %s".formatted(ticker, previous, instrument));
      }
    });

    this.tickerByInstrument = Collections.unmodifiableMap(tickers);
    this.instrumentByTicker = Map.copyOf(reverse);
    this.baseCurrency = cfg.baseCurrency();
  }

  public String ticker(Instrument instrument) {
    return tickerByInstrument.get(instrument);
  }

  public Optional<Instrument> instrument(String ticker) {
    if (ticker == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(instrumentByTicker.get(ticker.trim().toUpperCase(Locale.ROOT)));
  }

  public String baseCurrency() {
    return baseCurrency;
  }
}

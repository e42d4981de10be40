package com.ritbot.hft.strategy.service;

import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.InstrumentTickers;
import com.ritbot.hft.rit.api.SecurityPosition;
import com.ritbot.hft.rit.client.ExchangeClient;
import com.ritbot.hft.strategy.model.PositionSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads positions fresh from the venue. Nothing is cached between calls.
 */
@Slf4j
public class PositionLedger {

    private final ExchangeClient exchange;
    private final InstrumentTickers tickers;

    public PositionLedger(ExchangeClient exchange, InstrumentTickers tickers) {
        this.exchange = exchange;
        this.tickers = tickers;
    }

    /**
     * Current positions with zero defaults, or empty when the venue could not be read.
     * Callers treat empty as "unknown", never as flat.
     */
    public Optional<PositionSnapshot> positions() {
        List<SecurityPosition> securities;
        try {
            securities = exchange.getPositions();
        } catch (Exception e) {
            log.debug("positions fetch failed: {}", e.getMessage());
            return Optional.empty();
        }
        if (securities == null) {
            return Optional.empty();
        }

        Map<Instrument, Long> positions = new EnumMap<>(Instrument.class);
        Map<String, Double> cash = new HashMap<>();
        for (SecurityPosition security : securities) {
            if (security == null || security.ticker() == null) continue;
            Optional<Instrument> instrument = tickers.instrument(security.ticker());
            if (instrument.isPresent()) {
                positions.merge(instrument.get(), Math.round(security.position()), Long::sum);
            } else {
                cash.merge(security.ticker(), security.position(), Double::sum);
            }
        }
        return Optional.of(new PositionSnapshot(positions, cash));
    }
}

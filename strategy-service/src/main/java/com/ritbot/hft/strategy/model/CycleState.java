package com.ritbot.hft.strategy.model;

import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.Quote;
import com.ritbot.hft.rit.api.TickStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything one loop iteration knows about the venue. Built once per cycle and passed
 * to each component; positions are replaced after any stage that sent orders.
 */
public record CycleState(
        Instant at,
        TickStatus status,
        PositionSnapshot positions,
        Map<Instrument, Quote> quotes
) {

    public CycleState {
        EnumMap<Instrument, Quote> complete = new EnumMap<>(Instrument.class);
        for (Instrument instrument : Instrument.values()) {
            Quote q = quotes == null ? null : quotes.get(instrument);
            complete.put(instrument, q == null ? Quote.EMPTY : q);
        }
        quotes = Collections.unmodifiableMap(complete);
        if (positions == null) {
            positions = PositionSnapshot.flat();
        }
    }

    public Quote quote(Instrument instrument) {
        return quotes.get(instrument);
    }

    public long position(Instrument instrument) {
        return positions.position(instrument);
    }

    public int tick() {
        return status == null ? 0 : status.tick();
    }

    public CycleState withPositions(PositionSnapshot refreshed) {
        return new CycleState(at, status, refreshed, quotes);
    }
}

package com.ritbot.hft.strategy.model;

import com.ritbot.hft.market.Instrument;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Positions as read from the venue for one cycle. Every instrument is present, zero when flat.
 * Cash balances for tickers outside the traded set (e.g. the base currency) are kept separately.
 */
public record PositionSnapshot(Map<Instrument, Long> positions, Map<String, Double> cash) {

    public PositionSnapshot {
        EnumMap<Instrument, Long> complete = new EnumMap<>(Instrument.class);
        for (Instrument instrument : Instrument.values()) {
            Long value = positions == null ? null : positions.get(instrument);
            complete.put(instrument, value == null ? 0L : value);
        }
        positions = Collections.unmodifiableMap(complete);
        cash = cash == null ? Map.of() : Map.copyOf(cash);
    }

    public static PositionSnapshot flat() {
        return new PositionSnapshot(Map.of(), Map.of());
    }

    public static PositionSnapshot of(Map<Instrument, Long> positions) {
        return new PositionSnapshot(positions, Map.of());
    }

    public long position(Instrument instrument) {
        return positions.get(instrument);
    }

    public ExposureSnapshot exposure() {
        return ExposureSnapshot.of(positions);
    }

    /**
     * Share instruments closed out, currency and cash left as they are.
     */
    public PositionSnapshot withSharesFlat() {
        EnumMap<Instrument, Long> projected = new EnumMap<>(Instrument.class);
        projected.put(Instrument.CURRENCY, positions.get(Instrument.CURRENCY));
        return new PositionSnapshot(projected, cash);
    }

    /**
     * Positions after every leg is filled in full.
     */
    public PositionSnapshot apply(Iterable<OrderIntent> legs) {
        EnumMap<Instrument, Long> projected = new EnumMap<>(positions);
        for (OrderIntent leg : legs) {
            projected.merge(leg.instrument(), leg.signedQuantity(), Long::sum);
        }
        return new PositionSnapshot(projected, cash);
    }
}

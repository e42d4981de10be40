package com.ritbot.hft.strategy.model;

import com.ritbot.hft.market.Instrument;

import java.util.Map;

/**
 * Multiplier-weighted share exposure. Currency holdings are excluded.
 */
public record ExposureSnapshot(long gross, long net) {

    public static ExposureSnapshot of(Map<Instrument, Long> positions) {
        long gross = 0;
        long net = 0;
        for (Map.Entry<Instrument, Long> e : positions.entrySet()) {
            Instrument instrument = e.getKey();
            if (instrument.isCurrency() || e.getValue() == null) {
                continue;
            }
            long weighted = e.getValue() * instrument.riskMultiplier();
            gross += Math.abs(weighted);
            net += weighted;
        }
        return new ExposureSnapshot(gross, net);
    }
}

package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.events.EngineEventPublisher;
import com.ritbot.hft.events.EngineEventTypes;
import com.ritbot.hft.events.payload.ConverterAdvisoryEvent;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.strategy.model.CycleState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags inventory close to a converter block. The converter is operated manually;
 * this only publishes advisories.
 */
@Slf4j
public class ConverterAdvisor {

    static final double BLOCK_FRACTION = 0.8;
    static final double SPREAD_RATIO = 1.5;
    static final double GROSS_USAGE_ALERT = 0.9;

    private final ArbProperties.Converter cfg;
    private final ArbProperties.Risk risk;
    private final EngineEventPublisher events;
    private final Clock clock;

    public ConverterAdvisor(ArbProperties.Converter cfg, ArbProperties.Risk risk, EngineEventPublisher events,
                            Clock clock) {
        this.cfg = cfg;
        this.risk = risk;
        this.events = events;
        this.clock = clock;
    }

    public List<ConverterAdvisoryEvent> advise(CycleState state) {
        List<ConverterAdvisoryEvent> out = new ArrayList<>();
        if (!Boolean.TRUE.equals(cfg.enabled()) || state.tick() % cfg.adviceEveryTicks() != 0) {
            return out;
        }

        long composite = state.position(Instrument.COMPOSITE);
        long a = state.position(Instrument.COMPONENT_A);
        long b = state.position(Instrument.COMPONENT_B);
        double compositeSpread = state.quote(Instrument.COMPOSITE).spread();
        double basketSpread = state.quote(Instrument.COMPONENT_A).spread() + state.quote(Instrument.COMPONENT_B).spread();
        double grossUsage = (double) state.positions().exposure().gross() / risk.grossLimit();
        double fee = cfg.costPerConversion() * state.quote(Instrument.CURRENCY).mid();
        double nearBlock = BLOCK_FRACTION * cfg.blockSize();
        boolean crowded = grossUsage > GROSS_USAGE_ALERT;

        if (composite >= nearBlock && (compositeSpread > SPREAD_RATIO * basketSpread || crowded)) {
            out.add(new ConverterAdvisoryEvent("REDEEM", composite, a, b, compositeSpread, basketSpread, grossUsage, fee));
        }
        if (Math.min(a, b) >= nearBlock && (basketSpread > SPREAD_RATIO * compositeSpread || crowded)) {
            out.add(new ConverterAdvisoryEvent("CREATE", composite, a, b, compositeSpread, basketSpread, grossUsage, fee));
        }

        for (ConverterAdvisoryEvent advisory : out) {
            log.info("CONVERTER: consider {} (composite={}, basket={}/{}, gross usage={})",
                    advisory.direction(), composite, a, b, String.format("%.1f%%", grossUsage * 100));
            events.publish(clock.instant(), EngineEventTypes.CONVERTER_ADVISORY, advisory.direction(), advisory);
        }
        return out;
    }
}

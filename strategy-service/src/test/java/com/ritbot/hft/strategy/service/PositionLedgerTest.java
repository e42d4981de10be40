package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.InstrumentTickers;
import com.ritbot.hft.strategy.StubExchangeClient;
import com.ritbot.hft.strategy.model.PositionSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PositionLedgerTest {

    private StubExchangeClient exchange;
    private PositionLedger ledger;

    @BeforeEach
    void setUp() {
        exchange = new StubExchangeClient();
        ledger = new PositionLedger(exchange, new InstrumentTickers(ArbProperties.defaults().instruments()));
    }

    @Test
    void shouldMapTickersAndKeepCashSeparately() {
        // Given
        exchange.setPosition("bull", 1_000);
        exchange.setPosition("RITC", -500);
        exchange.setPosition("USD", -9_712.6);
        exchange.setPosition("CAD", 1_000_000.0);

        // When
        Optional<PositionSnapshot> snapshot = ledger.positions();

        // Then
        assertThat(snapshot).isPresent();
        PositionSnapshot positions = snapshot.get();
        assertThat(positions.position(Instrument.COMPONENT_A)).isEqualTo(1_000L);
        assertThat(positions.position(Instrument.COMPONENT_B)).isZero();
        assertThat(positions.position(Instrument.COMPOSITE)).isEqualTo(-500L);
        assertThat(positions.position(Instrument.CURRENCY)).isEqualTo(-9_713L);
        assertThat(positions.cash()).containsEntry("CAD", 1_000_000.0);
        assertThat(positions.exposure().gross()).isEqualTo(2_000L);
        assertThat(positions.exposure().net()).isZero();
    }

    @Test
    void shouldReportUnknownRatherThanFlatWhenVenueFails() {
        exchange.setPositionsUnavailable(true);

        assertThat(ledger.positions()).isEmpty();
    }
}

package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties;
import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.InstrumentTickers;
import com.ritbot.hft.rit.client.ExchangeClient;
import com.ritbot.hft.strategy.metrics.StrategyMetricsService;
import com.ritbot.hft.strategy.model.OrderIntent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Write side of the venue. Splits orders at the per-order ceiling and never lets a
 * submission failure escape as an exception.
 */
@Slf4j
public class OrderRouter {

    private final ExchangeClient exchange;
    private final InstrumentTickers tickers;
    private final ArbProperties.Risk risk;
    private final StrategyMetricsService metrics;

    public OrderRouter(ExchangeClient exchange, InstrumentTickers tickers, ArbProperties.Risk risk,
                       StrategyMetricsService metrics) {
        this.exchange = exchange;
        this.tickers = tickers;
        this.risk = risk;
        this.metrics = metrics;
    }

    public long maxOrderSize(Instrument instrument) {
        return instrument.isCurrency() ? risk.maxCurrencyOrderSize() : risk.maxOrderSize();
    }

    public List<Long> chunks(Instrument instrument, long quantity) {
        List<Long> out = new ArrayList<>();
        long max = maxOrderSize(instrument);
        long remaining = quantity;
        while (remaining > 0) {
            long chunk = Math.min(remaining, max);
            out.add(chunk);
            remaining -= chunk;
        }
        return out;
    }

    /**
     * Sends the intent as sequential chunks, stopping at the first rejected chunk.
     *
     * @return quantity the venue acknowledged
     */
    public long submit(OrderIntent intent) {
        long acknowledged = 0;
        for (long chunk : chunks(intent.instrument(), intent.quantity())) {
            if (!submitOnce(intent.withQuantity(chunk))) {
                break;
            }
            acknowledged += chunk;
        }
        return acknowledged;
    }

    /**
     * One venue submission. The quantity must already respect the per-order ceiling.
     */
    public boolean submitOnce(OrderIntent intent) {
        if (intent.quantity() <= 0) {
            return false;
        }
        String ticker = tickers.ticker(intent.instrument());
        boolean ok;
        try {
            ok = exchange.submitOrder(ticker, intent.side(), intent.quantity(), intent.style(), intent.price());
        } catch (Exception e) {
            log.debug("order submit failed {} {} {} {}: {}", ticker, intent.side(), intent.quantity(),
                    intent.style(), e.getMessage());
            ok = false;
        }
        metrics.recordOrder(intent.instrument(), ok);
        if (!ok) {
            log.info("order not accepted: {} {} {} {} price={}", intent.side(), intent.quantity(), ticker,
                    intent.style(), intent.price());
        }
        return ok;
    }

    public boolean acceptTender(long tenderId) {
        try {
            return exchange.acceptTender(tenderId);
        } catch (Exception e) {
            log.warn("tender {} accept failed: {}", tenderId, e.getMessage());
            return false;
        }
    }
}

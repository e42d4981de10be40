package com.ritbot.hft.strategy.service;

import com.ritbot.hft.market.Instrument;
import com.ritbot.hft.market.InstrumentTickers;
import com.ritbot.hft.market.Quote;
import com.ritbot.hft.rit.api.OrderBook;
import com.ritbot.hft.rit.api.TenderOffer;
import com.ritbot.hft.rit.api.TickStatus;
import com.ritbot.hft.rit.client.ExchangeClient;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the venue. Failures degrade to sentinel quotes or an unreachable status.
 */
@Slf4j
public class MarketDataGateway {

    private final ExchangeClient exchange;
    private final InstrumentTickers tickers;

    public MarketDataGateway(ExchangeClient exchange, InstrumentTickers tickers) {
        this.exchange = exchange;
        this.tickers = tickers;
    }

    public TickStatus tickStatus() {
        try {
            TickStatus status = exchange.getStatus();
            return status == null ? TickStatus.unreachable() : status;
        } catch (Exception e) {
            log.debug("case status fetch failed: {}", e.getMessage());
            return TickStatus.unreachable();
        }
    }

    public Optional<OrderBook> book(Instrument instrument) {
        String ticker = tickers.ticker(instrument);
        try {
            return Optional.ofNullable(exchange.getBook(ticker));
        } catch (Exception e) {
            log.debug("book fetch failed for {}: {}", ticker, e.getMessage());
            return Optional.empty();
        }
    }

    public Quote quote(Instrument instrument) {
        return book(instrument).map(MarketDataGateway::toQuote).orElse(Quote.EMPTY);
    }

    public Map<Instrument, Quote> quotes() {
        Map<Instrument, Quote> out = new EnumMap<>(Instrument.class);
        for (Instrument instrument : Instrument.values()) {
            out.put(instrument, quote(instrument));
        }
        return out;
    }

    public List<TenderOffer> openTenders() {
        try {
            List<TenderOffer> offers = exchange.getOpenTenders();
            return offers == null ? List.of() : offers;
        } catch (Exception e) {
            log.debug("tender fetch failed: {}", e.getMessage());
            return List.of();
        }
    }

    static Quote toQuote(OrderBook book) {
        return new Quote(
                book.bestBid().orElse(Quote.NO_BID),
                book.bestAsk().orElse(Quote.NO_ASK)
        );
    }
}

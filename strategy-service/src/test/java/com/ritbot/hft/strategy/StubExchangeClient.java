package com.ritbot.hft.strategy;

import com.ritbot.hft.rit.api.BookLevel;
import com.ritbot.hft.rit.api.CaseStatus;
import com.ritbot.hft.rit.api.OrderBook;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.rit.api.OrderStyle;
import com.ritbot.hft.rit.api.SecurityPosition;
import com.ritbot.hft.rit.api.TenderOffer;
import com.ritbot.hft.rit.api.TickStatus;
import com.ritbot.hft.rit.client.ExchangeClient;
import com.ritbot.hft.rit.client.ExchangeException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory venue for strategy tests. Records every order and tender acceptance; order
 * failures can be scripted per ticker.
 */
public class StubExchangeClient implements ExchangeClient {

    public record SubmittedOrder(String ticker, OrderSide side, long quantity, OrderStyle style, Double price) {
    }

    private final List<SubmittedOrder> submittedOrders = new ArrayList<>();
    private final List<Long> acceptedTenders = new ArrayList<>();
    private final Map<String, OrderBook> books = new HashMap<>();
    private final Map<String, Integer> failuresRemaining = new HashMap<>();
    private final Map<String, Double> positions = new LinkedHashMap<>();
    private final List<TenderOffer> tenders = new ArrayList<>();

    private TickStatus status = TickStatus.of(1, CaseStatus.ACTIVE);
    private boolean positionsUnavailable;
    private boolean tenderAcceptResult = true;

    public void setStatus(int tick, CaseStatus caseStatus) {
        this.status = TickStatus.of(tick, caseStatus);
    }

    public void setQuote(String ticker, double bid, double ask) {
        books.put(ticker, new OrderBook(ticker,
                List.of(new BookLevel(bid, 100_000)),
                List.of(new BookLevel(ask, 100_000))));
    }

    public void setBook(OrderBook book) {
        books.put(book.ticker(), book);
    }

    public void setPosition(String ticker, double position) {
        positions.put(ticker, position);
    }

    public void setPositionsUnavailable(boolean unavailable) {
        this.positionsUnavailable = unavailable;
    }

    public void addTender(TenderOffer offer) {
        tenders.add(offer);
    }

    public void setTenderAcceptResult(boolean result) {
        this.tenderAcceptResult = result;
    }

    /**
     * The next {@code count} orders for {@code ticker} are rejected.
     */
    public void failNext(String ticker, int count) {
        failuresRemaining.put(ticker, count);
    }

    public void failAlways(String ticker) {
        failuresRemaining.put(ticker, Integer.MAX_VALUE);
    }

    public List<SubmittedOrder> getSubmittedOrders() {
        return submittedOrders;
    }

    public List<SubmittedOrder> ordersFor(String ticker) {
        return submittedOrders.stream().filter(o -> o.ticker().equals(ticker)).toList();
    }

    public List<Long> getAcceptedTenders() {
        return acceptedTenders;
    }

    @Override
    public TickStatus getStatus() {
        return status;
    }

    @Override
    public OrderBook getBook(String ticker) {
        return books.getOrDefault(ticker, OrderBook.empty(ticker));
    }

    @Override
    public List<SecurityPosition> getPositions() {
        if (positionsUnavailable) {
            throw ExchangeException.transientFailure("positions unavailable", null);
        }
        List<SecurityPosition> out = new ArrayList<>();
        positions.forEach((ticker, position) -> out.add(new SecurityPosition(ticker, position)));
        return out;
    }

    @Override
    public List<TenderOffer> getOpenTenders() {
        return List.copyOf(tenders);
    }

    @Override
    public boolean submitOrder(String ticker, OrderSide side, long quantity, OrderStyle style, Double price) {
        submittedOrders.add(new SubmittedOrder(ticker, side, quantity, style, price));
        Integer remaining = failuresRemaining.get(ticker);
        if (remaining != null && remaining > 0) {
            if (remaining != Integer.MAX_VALUE) {
                failuresRemaining.put(ticker, remaining - 1);
            }
            return false;
        }
        return true;
    }

    @Override
    public boolean acceptTender(long tenderId) {
        if (!tenderAcceptResult) {
            return false;
        }
        acceptedTenders.add(tenderId);
        tenders.removeIf(t -> t.id() == tenderId);
        return true;
    }
}

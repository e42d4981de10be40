package com.ritbot.hft.rit.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ritbot.hft.rit.api.BookLevel;
import com.ritbot.hft.rit.api.CaseStatus;
import com.ritbot.hft.rit.api.OrderBook;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.rit.api.OrderStyle;
import com.ritbot.hft.rit.api.SecurityPosition;
import com.ritbot.hft.rit.api.TenderOffer;
import com.ritbot.hft.rit.api.TickStatus;
import com.ritbot.hft.rit.http.ExchangeHttpTransport;
import com.ritbot.hft.rit.http.HttpRequestFactory;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST client for the RIT exchange simulator ({@code /v1} API).
 */
@Slf4j
public final class RitExchangeClient implements ExchangeClient {

  private final HttpRequestFactory requestFactory;
  private final ExchangeHttpTransport transport;
  private final Duration timeout;
  private final int bookDepth;

  public RitExchangeClient(
      @NonNull HttpRequestFactory requestFactory,
      @NonNull ExchangeHttpTransport transport,
      @NonNull Duration timeout,
      int bookDepth
  ) {
    this.requestFactory = requestFactory;
    this.transport = transport;
    this.timeout = timeout;
    this.bookDepth = Math.max(1, bookDepth);
  }

  @Override
  public TickStatus getStatus() {
    return parseCase(getJson("/case", Map.of()));
  }

  @Override
  public OrderBook getBook(String ticker) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("ticker", ticker);
    query.put("limit", Integer.toString(bookDepth));
    return parseBook(ticker, getJson("/securities/book", query));
  }

  @Override
  public List<SecurityPosition> getPositions() {
    return parsePositions(getJson("/securities", Map.of()));
  }

  @Override
  public List<TenderOffer> getOpenTenders() {
    return parseTenders(getJson("/tenders", Map.of()));
  }

  @Override
  public boolean submitOrder(String ticker, OrderSide side, long quantity, OrderStyle style, Double price) {
    if (quantity <= 0) {
      return false;
    }
    if (style == OrderStyle.LIMIT && (price == null || !(price > 0) || price.isInfinite())) {
      log.debug("limit order for {} without usable price {}, not sent", ticker, price);
      return false;
    }
    Map<String, String> query = new LinkedHashMap<>();
    query.put("ticker", ticker);
    query.put("type", style.name());
    query.put("quantity", Long.toString(quantity));
    query.put("action", side.name());
    if (style == OrderStyle.LIMIT) {
      query.put("price", String.format(Locale.ROOT, "%.4f", price));
    }
    int status = post("/orders", query);
    if (!ExchangeHttpTransport.isSuccess(status)) {
      log.debug("order rejected ticker={} side={} qty={} style={} status={}", ticker, side, quantity, style, status);
      return false;
    }
    return true;
  }

  @Override
  public boolean acceptTender(long tenderId) {
    int status = post("/tenders/" + tenderId, Map.of());
    if (!ExchangeHttpTransport.isSuccess(status)) {
      log.debug("tender {} accept rejected status={}", tenderId, status);
      return false;
    }
    return true;
  }

  static TickStatus parseCase(JsonNode node) {
    if (node == null || !node.isObject()) {
      return TickStatus.unreachable();
    }
    return TickStatus.of(node.path("tick").asInt(0), CaseStatus.parse(node.path("status").asText(null)));
  }

  static OrderBook parseBook(String ticker, JsonNode node) {
    if (node == null || !node.isObject()) {
      return OrderBook.empty(ticker);
    }
    return new OrderBook(ticker, parseLevels(node.path("bids")), parseLevels(node.path("asks")));
  }

  static List<SecurityPosition> parsePositions(JsonNode node) {
    List<SecurityPosition> out = new ArrayList<>();
    if (node == null || !node.isArray()) {
      return out;
    }
    for (JsonNode security : node) {
      String ticker = security.path("ticker").asText(null);
      if (ticker == null || ticker.isBlank()) {
        continue;
      }
      out.add(new SecurityPosition(ticker, security.path("position").asDouble(0.0)));
    }
    return out;
  }

  static List<TenderOffer> parseTenders(JsonNode node) {
    List<TenderOffer> out = new ArrayList<>();
    if (node == null || !node.isArray()) {
      return out;
    }
    for (JsonNode tender : node) {
      OrderSide action = parseSide(tender.path("action").asText(null));
      long quantity = tender.path("quantity").asLong(0);
      if (action == null || quantity <= 0 || !tender.hasNonNull("tender_id")) {
        continue;
      }
      out.add(new TenderOffer(
          tender.path("tender_id").asLong(),
          tender.path("ticker").asText(null),
          action,
          tender.path("price").asDouble(0.0),
          quantity
      ));
    }
    return out;
  }

  private static List<BookLevel> parseLevels(JsonNode levels) {
    List<BookLevel> out = new ArrayList<>();
    if (levels == null || !levels.isArray()) {
      return out;
    }
    for (JsonNode level : levels) {
      double price = level.path("price").asDouble(0.0);
      long remaining = level.path("quantity").asLong(0) - level.path("quantity_filled").asLong(0);
      if (price > 0 && remaining > 0) {
        out.add(new BookLevel(price, remaining));
      }
    }
    return out;
  }

  private static OrderSide parseSide(String raw) {
    if (raw == null) {
      return null;
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "BUY" -> OrderSide.BUY;
      case "SELL" -> OrderSide.SELL;
      default -> null;
    };
  }

  private JsonNode getJson(String path, Map<String, String> query) {
    HttpRequest request = requestFactory.request(path, query)
        .GET()
        .timeout(timeout)
        .build();
    return transport.sendJson(request, JsonNode.class);
  }

  private int post(String path, Map<String, String> query) {
    HttpRequest request = requestFactory.request(path, query)
        .POST(HttpRequest.BodyPublishers.noBody())
        .timeout(timeout)
        .build();
    return transport.sendForStatus(request);
  }
}

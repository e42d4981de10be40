package com.ritbot.hft.rit.client;

import com.ritbot.hft.rit.api.OrderBook;
import com.ritbot.hft.rit.api.OrderSide;
import com.ritbot.hft.rit.api.OrderStyle;
import com.ritbot.hft.rit.api.SecurityPosition;
import com.ritbot.hft.rit.api.TenderOffer;
import com.ritbot.hft.rit.api.TickStatus;

import java.util.List;

/**
 * Synchronous venue boundary. Reads may throw {@link ExchangeException}; submissions report
 * success only on an explicit positive acknowledgement.
 */
public interface ExchangeClient {

  TickStatus getStatus();

  OrderBook getBook(String ticker);

  /**
   * Holdings for every ticker, including currency cash balances.
   */
  List<SecurityPosition> getPositions();

  List<TenderOffer> getOpenTenders();

  /**
   * @param price limit price, ignored (and may be null) for market orders
   * @return true only when the venue accepted the order
   */
  boolean submitOrder(String ticker, OrderSide side, long quantity, OrderStyle style, Double price);

  boolean acceptTender(long tenderId);
}

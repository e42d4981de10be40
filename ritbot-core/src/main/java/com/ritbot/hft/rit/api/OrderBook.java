package com.ritbot.hft.rit.api;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Book snapshot, bids best-first (descending), asks best-first (ascending).
 */
public record OrderBook(String ticker, List<BookLevel> bids, List<BookLevel> asks) {

  public OrderBook {
    bids = bids == null ? List.of() : List.copyOf(bids);
    asks = asks == null ? List.of() : List.copyOf(asks);
  }

  public static OrderBook empty(String ticker) {
    return new OrderBook(ticker, List.of(), List.of());
  }

  public OptionalDouble bestBid() {
    return bids.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(bids.get(0).price());
  }

  public OptionalDouble bestAsk() {
    return asks.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(asks.get(0).price());
  }

  /**
   * Volume-weighted price to fill {@code quantity} against the book.
   * A {@link OrderSide#SELL} walks the bids, a {@link OrderSide#BUY} walks the asks.
   * Empty when the visible depth cannot absorb the full quantity.
   */
  public OptionalDouble walk(OrderSide side, long quantity) {
    if (quantity <= 0) {
      return OptionalDouble.empty();
    }
    List<BookLevel> levels = side == OrderSide.SELL ? bids : asks;
    long remaining = quantity;
    double notional = 0.0;
    for (BookLevel level : levels) {
      if (level == null || level.quantity() <= 0) {
        continue;
      }
      long take = Math.min(remaining, level.quantity());
      notional += take * level.price();
      remaining -= take;
      if (remaining == 0) {
        return OptionalDouble.of(notional / quantity);
      }
    }
    return OptionalDouble.empty();
  }
}

package com.ritbot.hft.market;

/**
 * Best bid/ask. A missing side is carried as a sentinel (bid 0, ask +inf) so that
 * any edge computed against it is never profitable.
 */
public record Quote(double bid, double ask) {

  public static final double NO_BID = 0.0;
  public static final double NO_ASK = Double.POSITIVE_INFINITY;

  public static final Quote EMPTY = new Quote(NO_BID, NO_ASK);

  public Quote {
    if (Double.isNaN(bid) || bid < 0) {
      bid = NO_BID;
    }
    if (Double.isNaN(ask) || ask <= 0) {
      ask = NO_ASK;
    }
  }

  public boolean hasBid() {
    return bid > NO_BID;
  }

  public boolean hasAsk() {
    return ask < NO_ASK;
  }

  public boolean isTwoSided() {
    return hasBid() && hasAsk();
  }

  /**
   * Mid price, or 0 when either side is missing.
   */
  public double mid() {
    return isTwoSided() ? (bid + ask) / 2.0 : 0.0;
  }

  public double spread() {
    return isTwoSided() ? Math.max(0.0, ask - bid) : 0.0;
  }
}

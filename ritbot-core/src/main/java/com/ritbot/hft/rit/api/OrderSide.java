package com.ritbot.hft.rit.api;

public enum OrderSide {
  BUY,
  SELL;

  public int sign() {
    return this == BUY ? 1 : -1;
  }

  public OrderSide opposite() {
    return this == BUY ? SELL : BUY;
  }

  /**
   * Side that moves a signed position by {@code delta}.
   */
  public static OrderSide forDelta(double delta) {
    return delta >= 0 ? BUY : SELL;
  }
}

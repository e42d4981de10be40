package com.ritbot.hft.market;

/**
 * Instrument roles traded by the engine. The composite counts double toward share limits.
 */
public enum Instrument {
  COMPONENT_A(1),
  COMPONENT_B(1),
  COMPOSITE(2),
  CURRENCY(1);

  private final int riskMultiplier;

  Instrument(int riskMultiplier) {
    this.riskMultiplier = riskMultiplier;
  }

  public int riskMultiplier() {
    return riskMultiplier;
  }

  public boolean isCurrency() {
    return this == CURRENCY;
  }

  public boolean isComponent() {
    return this == COMPONENT_A || this == COMPONENT_B;
  }
}

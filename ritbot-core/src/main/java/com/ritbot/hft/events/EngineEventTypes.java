package com.ritbot.hft.events;

public final class EngineEventTypes {

  public static final String ARBITRAGE_EXECUTED = "strategy.arbitrage.executed";
  public static final String TENDER_ACCEPTED = "strategy.tender.accepted";
  public static final String TENDER_REJECTED = "strategy.tender.rejected";
  public static final String HEDGE_EXHAUSTED = "strategy.hedge.exhausted";
  public static final String UNWIND_ENGAGED = "strategy.unwind.engaged";
  public static final String UNWIND_RELEASED = "strategy.unwind.released";
  public static final String CONVERTER_ADVISORY = "strategy.converter.advisory";
  public static final String CASE_STOPPED = "strategy.case.stopped";

  private EngineEventTypes() {
  }
}

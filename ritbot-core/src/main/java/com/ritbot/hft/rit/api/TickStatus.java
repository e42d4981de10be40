package com.ritbot.hft.rit.api;

/**
 * Case clock as reported by the venue.
 *
 * @param reachable false when the status could not be fetched; such a status never trades
 */
public record TickStatus(int tick, CaseStatus status, boolean reachable) {

  public static TickStatus of(int tick, CaseStatus status) {
    return new TickStatus(tick, status == null ? CaseStatus.STOPPED : status, true);
  }

  public static TickStatus unreachable() {
    return new TickStatus(0, CaseStatus.STOPPED, false);
  }

  public boolean isActive() {
    return reachable && status == CaseStatus.ACTIVE;
  }

  public boolean isStopped() {
    return reachable && status == CaseStatus.STOPPED;
  }
}

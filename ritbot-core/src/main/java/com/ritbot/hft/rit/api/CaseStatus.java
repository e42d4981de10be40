package com.ritbot.hft.rit.api;

import java.util.Locale;

public enum CaseStatus {
  ACTIVE,
  PAUSED,
  STOPPED;

  /**
   * Unknown or missing values map to {@link #STOPPED} so the engine never trades on them.
   */
  public static CaseStatus parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return STOPPED;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return STOPPED;
    }
  }
}

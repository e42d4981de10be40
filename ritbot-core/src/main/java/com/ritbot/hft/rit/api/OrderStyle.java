package com.ritbot.hft.rit.api;

public enum OrderStyle {
  MARKET,
  LIMIT
}

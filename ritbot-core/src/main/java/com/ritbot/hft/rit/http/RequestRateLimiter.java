package com.ritbot.hft.rit.http;

public interface RequestRateLimiter {

  void acquire();

  static RequestRateLimiter noop() {
    return () -> {
    };
  }
}

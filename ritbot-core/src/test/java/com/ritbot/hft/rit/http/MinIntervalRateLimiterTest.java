package com.ritbot.hft.rit.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class MinIntervalRateLimiterTest {

  @Test
  void waitsOnlyForTheRemainderOfTheInterval() {
    AtomicLong now = new AtomicLong(1_000_000_000L);
    List<Duration> waits = new ArrayList<>();
    MinIntervalRateLimiter limiter = new MinIntervalRateLimiter(Duration.ofMillis(100), now::get, waits::add);

    limiter.acquire();
    now.addAndGet(Duration.ofMillis(30).toNanos());
    limiter.acquire();
    now.addAndGet(Duration.ofMillis(500).toNanos());
    limiter.acquire();

    assertThat(waits).containsExactly(Duration.ofMillis(70));
  }
}

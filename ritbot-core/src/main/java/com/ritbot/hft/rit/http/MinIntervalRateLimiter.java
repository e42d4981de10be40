package com.ritbot.hft.rit.http;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Spaces requests at least {@code minInterval} apart. The simulator throttles per API key
 * and answers bursts with 429.
 */
public final class MinIntervalRateLimiter implements RequestRateLimiter {

  private final long minIntervalNanos;
  private final LongSupplier nanoTime;
  private final Sleeper sleeper;

  private long nextAllowedNanos;
  private boolean primed;

  public MinIntervalRateLimiter(Duration minInterval) {
    this(minInterval, System::nanoTime, d -> TimeUnit.NANOSECONDS.sleep(d.toNanos()));
  }

  MinIntervalRateLimiter(Duration minInterval, LongSupplier nanoTime, Sleeper sleeper) {
    this.minIntervalNanos = Math.max(0L, Objects.requireNonNull(minInterval, "minInterval").toNanos());
    this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public synchronized void acquire() {
    long now = nanoTime.getAsLong();
    if (primed && now < nextAllowedNanos) {
      long waitNanos = nextAllowedNanos - now;
      try {
        sleeper.sleep(Duration.ofNanos(waitNanos));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting for request slot", e);
      }
      now = nextAllowedNanos;
    }
    nextAllowedNanos = now + minIntervalNanos;
    primed = true;
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}

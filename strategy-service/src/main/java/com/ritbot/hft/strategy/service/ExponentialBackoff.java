package com.ritbot.hft.strategy.service;

import java.time.Duration;
import java.util.Objects;

/**
 * Capped exponential backoff: {@code initial * multiplier^(attempt-1)}, never above {@code max}.
 */
public class ExponentialBackoff {

    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;

    public ExponentialBackoff(Duration initialBackoff, Duration maxBackoff, double multiplier) {
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        this.multiplier = Math.max(1.0d, multiplier);
    }

    public Duration backoffForAttempt(int attempt) {
        long initialMillis = Math.max(0L, initialBackoff.toMillis());
        long maxMillis = Math.max(initialMillis, maxBackoff.toMillis());
        if (initialMillis == 0L) {
            return Duration.ZERO;
        }

        int exponent = Math.max(0, attempt - 1);
        double scaled = initialMillis * Math.pow(multiplier, exponent);
        long bounded = (long) Math.min(maxMillis, scaled);
        return Duration.ofMillis(Math.max(0L, bounded));
    }
}

package com.venuelink.adapter.core.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Delay per attempt, capped at {@code max}: doubling or linear growth, optionally scaled by a
 * full-jitter factor.
 */
public final class BackoffPolicy {
  private final Duration base;
  private final Duration max;
  private final boolean linear;
  private final boolean jitter;
  private final DoubleSupplier random;

  private BackoffPolicy(
      Duration base, Duration max, boolean linear, boolean jitter, DoubleSupplier random) {
    if (base == null || base.isNegative()) {
      throw new IllegalArgumentException("base must be >= 0");
    }
    if (max == null || max.compareTo(base) < 0) {
      throw new IllegalArgumentException("max must be >= base");
    }
    this.base = base;
    this.max = max;
    this.linear = linear;
    this.jitter = jitter;
    this.random = Objects.requireNonNull(random, "random must not be null");
  }

  public static BackoffPolicy exponential(Duration base, Duration max) {
    return new BackoffPolicy(base, max, false, false, () -> 1.0d);
  }

  /** {@code attempt * step}, capped at {@code max}. */
  public static BackoffPolicy linear(Duration step, Duration max) {
    return new BackoffPolicy(step, max, true, false, () -> 1.0d);
  }

  public static BackoffPolicy jittered(Duration base, Duration max) {
    return jittered(base, max, () -> ThreadLocalRandom.current().nextDouble());
  }

  public static BackoffPolicy jittered(Duration base, Duration max, DoubleSupplier random) {
    return new BackoffPolicy(base, max, false, true, random);
  }

  public Duration delayFor(int attempt) {
    long ceiling = ceilingMillis(attempt);
    if (!jitter || ceiling == 0L) {
      return Duration.ofMillis(ceiling);
    }
    double factor = Math.min(Math.max(random.getAsDouble(), 0.0d), 1.0d);
    return Duration.ofMillis(Math.min(ceiling, Math.round(factor * ceiling)));
  }

  public Duration max() {
    return max;
  }

  private long ceilingMillis(int attempt) {
    long baseMs = base.toMillis();
    long maxMs = max.toMillis();
    if (linear) {
      long steps = Math.max(1, attempt);
      return baseMs == 0L || steps <= maxMs / baseMs ? Math.min(baseMs * steps, maxMs) : maxMs;
    }
    long value = baseMs;
    for (int step = 1; step < attempt && value < maxMs; step++) {
      value = value > maxMs / 2 ? maxMs : value * 2;
    }
    return Math.min(value, maxMs);
  }
}

package com.venuelink.adapter.core.retry;

import com.venuelink.adapter.core.error.ErrorKind;
import com.venuelink.adapter.core.error.ExchangeException;
import com.venuelink.adapter.core.error.RateLimitException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

  private final int maxAttempts;
  private final BackoffPolicy backoff;
  private final Set<ErrorKind> retryableKinds;
  private final Sleeper sleeper;

  public RetryExecutor(int maxAttempts, BackoffPolicy backoff) {
    this(
        maxAttempts,
        backoff,
        EnumSet.of(ErrorKind.RATE_LIMIT, ErrorKind.CONNECTION),
        duration -> Thread.sleep(duration.toMillis()));
  }

  public RetryExecutor(
      int maxAttempts,
      BackoffPolicy backoff,
      Set<ErrorKind> retryableKinds,
      Sleeper sleeper) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.retryableKinds =
        retryableKinds == null || retryableKinds.isEmpty()
            ? EnumSet.noneOf(ErrorKind.class)
            : EnumSet.copyOf(retryableKinds);
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public <T> T execute(Operation<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.run();
      } catch (ExchangeException ex) {
        if (!retryableKinds.contains(ex.kind()) || attempt >= maxAttempts) {
          throw ex;
        }
        Duration wait = resolveBackoff(ex, attempt);
        log.warn(
            "Retrying venue call venue={} error_kind={} attempt={} wait_ms={}",
            ex.venue(),
            ex.kind(),
            attempt,
            wait.toMillis());
        sleep(wait);
        attempt++;
      }
    }
  }

  private Duration resolveBackoff(ExchangeException ex, int attempt) {
    Duration computed = backoff.delayFor(attempt);
    if (ex instanceof RateLimitException rateLimited && !rateLimited.retryAfter().isZero()) {
      Duration hint = rateLimited.retryAfter();
      return hint.compareTo(backoff.max()) <= 0 ? hint : backoff.max();
    }
    return computed;
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during venue retry backoff", interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}

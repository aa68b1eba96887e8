package com.venuelink.adapter.core.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.venuelink.adapter.core.error.ConnectionException;
import com.venuelink.adapter.core.error.ErrorKind;
import com.venuelink.adapter.core.error.OrderException;
import com.venuelink.adapter.core.error.RateLimitException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryExecutorTest {
  private final List<Duration> waits = new ArrayList<>();
  private final RetryExecutor executor =
      new RetryExecutor(
          3,
          BackoffPolicy.exponential(Duration.ofMillis(1000), Duration.ofMillis(5000)),
          EnumSet.of(ErrorKind.RATE_LIMIT, ErrorKind.CONNECTION),
          waits::add);

  @Test
  void shouldRetryConnectionFailuresWithGrowingBackoff() {
    AtomicInteger attempts = new AtomicInteger();

    String actual =
        executor.execute(
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new ConnectionException("mock", "Simulated network error");
              }
              return "ok";
            });

    assertEquals("ok", actual);
    assertEquals(3, attempts.get());
    assertEquals(List.of(Duration.ofMillis(1000), Duration.ofMillis(2000)), waits);
  }

  @Test
  void shouldHonourRateLimitHint() {
    AtomicInteger attempts = new AtomicInteger();

    executor.execute(
        () -> {
          if (attempts.incrementAndGet() == 1) {
            throw new RateLimitException("gemini", "RateLimited", Duration.ofMillis(300));
          }
          return Boolean.TRUE;
        });

    assertEquals(List.of(Duration.ofMillis(300)), waits);
  }

  @Test
  void shouldNotRetryOrderErrors() {
    AtomicInteger attempts = new AtomicInteger();

    assertThrows(
        OrderException.class,
        () ->
            executor.execute(
                () -> {
                  attempts.incrementAndGet();
                  throw new OrderException("mock", "Order not found", "ord-1");
                }));

    assertEquals(1, attempts.get());
    assertEquals(List.of(), waits);
  }

  @Test
  void shouldRethrowLastFailureWhenAttemptsExhausted() {
    AtomicInteger attempts = new AtomicInteger();

    ConnectionException error =
        assertThrows(
            ConnectionException.class,
            () ->
                executor.execute(
                    () -> {
                      throw new ConnectionException(
                          "mock", "attempt " + attempts.incrementAndGet());
                    }));

    assertEquals("attempt 3", error.getMessage());
    assertEquals(2, waits.size());
  }
}

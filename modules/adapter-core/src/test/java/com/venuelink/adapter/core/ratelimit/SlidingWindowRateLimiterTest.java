package com.venuelink.adapter.core.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.venuelink.adapter.core.RequestClass;
import com.venuelink.adapter.core.error.RateLimitException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SlidingWindowRateLimiterTest {
  private final SteppingClock clock = new SteppingClock(Instant.parse("2026-03-01T00:00:00Z"));

  @Test
  void shouldAdmitUpToLimitWithinWindow() {
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter("gemini", "public", 3, Duration.ofSeconds(1), clock);

    limiter.acquire();
    limiter.acquire();
    limiter.acquire();

    assertEquals(0, limiter.remaining());
    RateLimitException error = assertThrows(RateLimitException.class, limiter::acquire);
    assertEquals("gemini", error.venue());
    assertEquals(Duration.ofSeconds(1), error.retryAfter());
  }

  @Test
  void shouldReportTimeUntilOldestEntryExpires() {
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter("gemini", "public", 2, Duration.ofSeconds(1), clock);
    limiter.acquire();
    clock.advance(Duration.ofMillis(400));
    limiter.acquire();
    clock.advance(Duration.ofMillis(100));

    RateLimitException error = assertThrows(RateLimitException.class, limiter::acquire);

    assertEquals(Duration.ofMillis(500), error.retryAfter());
  }

  @Test
  void shouldAdmitAgainOnceWindowHasSlid() {
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter("cryptocom", "private", 2, Duration.ofMillis(100), clock);
    limiter.acquire();
    limiter.acquire();
    assertThrows(RateLimitException.class, limiter::acquire);

    clock.advance(Duration.ofMillis(100));

    limiter.acquire();
    assertEquals(1, limiter.remaining());
  }

  @Test
  void shouldNotRecordRejectedAttempts() {
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter("mock", "public", 1, Duration.ofSeconds(1), clock);
    limiter.acquire();
    assertThrows(RateLimitException.class, limiter::acquire);
    assertThrows(RateLimitException.class, limiter::acquire);

    clock.advance(Duration.ofSeconds(1));

    assertEquals(1, limiter.remaining());
  }

  @Test
  void shouldReleaseEachAdmissionIndividuallyAsItAges() {
    SlidingWindowRateLimiter limiter =
        new SlidingWindowRateLimiter("mock", "public", 2, Duration.ofSeconds(1), clock);
    limiter.acquire();
    clock.advance(Duration.ofMillis(600));
    limiter.acquire();

    clock.advance(Duration.ofMillis(400));
    assertEquals(1, limiter.remaining());

    clock.advance(Duration.ofMillis(600));
    assertEquals(2, limiter.remaining());
  }

  @Test
  void shouldRejectInvalidConfiguration() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new SlidingWindowRateLimiter("mock", "public", 0, Duration.ofSeconds(1), clock));
    assertThrows(
        IllegalArgumentException.class,
        () -> new SlidingWindowRateLimiter("mock", "public", 1, Duration.ZERO, clock));
  }

  @Test
  void shouldCreateIndependentLimitersPerRequestClass() {
    RateLimitPolicy policy =
        new RateLimitPolicy(
            RateLimitQuota.perSecond(100), new RateLimitQuota(15, Duration.ofMillis(100)));

    Map<RequestClass, SlidingWindowRateLimiter> limiters =
        policy.createLimiters("cryptocom", clock);
    limiters.get(RequestClass.PRIVATE).acquire();

    assertEquals("private", limiters.get(RequestClass.PRIVATE).name());
    assertEquals(14, limiters.get(RequestClass.PRIVATE).remaining());
    assertEquals(100, limiters.get(RequestClass.PUBLIC).remaining());
  }

  private static final class SteppingClock extends Clock {
    private Instant now;

    private SteppingClock(Instant start) {
      this.now = start;
    }

    private void advance(Duration step) {
      now = now.plus(step);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}

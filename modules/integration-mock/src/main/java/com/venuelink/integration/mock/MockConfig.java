package com.venuelink.integration.mock;

import com.venuelink.adapter.core.ratelimit.RateLimitPolicy;
import com.venuelink.adapter.core.ratelimit.RateLimitQuota;
import com.venuelink.domain.market.CanonicalSymbol;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Simulation parameters for {@link MockExchangeAdapter}.
 *
 * @param seed seeds the simulator's {@code Random}; {@code null} draws a fresh seed
 * @param prices starting price per canonical symbol; the keys are the listed symbols
 * @param balances starting free balance per currency
 * @param minSlippage lower bound of the taker slippage applied to market fills, as a fraction
 * @param maxSlippage upper bound of the taker slippage, also used to size market buy reservations
 */
public record MockConfig(
    Duration minLatency,
    Duration maxLatency,
    MockFailureRates failureRates,
    Long seed,
    Map<String, BigDecimal> prices,
    Map<String, BigDecimal> balances,
    Duration tickInterval,
    Duration orderExecutionDelay,
    BigDecimal minSlippage,
    BigDecimal maxSlippage,
    Duration retryDelay,
    RateLimitPolicy rateLimits) {
  public static final Map<String, BigDecimal> DEFAULT_PRICES =
      orderedPrices(
          Map.entry("BTC/USD", new BigDecimal("50000")),
          Map.entry("ETH/USD", new BigDecimal("3000")),
          Map.entry("ETH/BTC", new BigDecimal("0.06")),
          Map.entry("LTC/USD", new BigDecimal("150")));
  public static final Map<String, BigDecimal> DEFAULT_BALANCES =
      Map.of("USD", new BigDecimal("10000"), "BTC", BigDecimal.ONE, "ETH", BigDecimal.TEN);
  public static final RateLimitPolicy DEFAULT_RATE_LIMITS =
      RateLimitPolicy.shared(RateLimitQuota.perMinute(600));

  public MockConfig {
    requireNonNegative(minLatency, "minLatency");
    requireNonNegative(maxLatency, "maxLatency");
    if (maxLatency.compareTo(minLatency) < 0) {
      throw new IllegalArgumentException("maxLatency must be >= minLatency");
    }
    failureRates = failureRates == null ? MockFailureRates.none() : failureRates;
    prices = canonicalPrices(prices == null || prices.isEmpty() ? DEFAULT_PRICES : prices);
    balances = upperCaseBalances(balances == null ? DEFAULT_BALANCES : balances);
    if (tickInterval == null || tickInterval.isNegative() || tickInterval.isZero()) {
      throw new IllegalArgumentException("tickInterval must be > 0");
    }
    requireNonNegative(orderExecutionDelay, "orderExecutionDelay");
    if (minSlippage == null || maxSlippage == null || minSlippage.signum() < 0) {
      throw new IllegalArgumentException("slippage bounds must be >= 0");
    }
    if (maxSlippage.compareTo(minSlippage) < 0 || maxSlippage.compareTo(BigDecimal.ONE) >= 0) {
      throw new IllegalArgumentException("maxSlippage must be within [minSlippage, 1)");
    }
    requireNonNegative(retryDelay, "retryDelay");
    rateLimits = rateLimits == null ? DEFAULT_RATE_LIMITS : rateLimits;
  }

  public static MockConfig defaults() {
    return new MockConfig(
        Duration.ofMillis(10),
        Duration.ofMillis(100),
        MockFailureRates.none(),
        null,
        DEFAULT_PRICES,
        DEFAULT_BALANCES,
        Duration.ofSeconds(1),
        Duration.ofMillis(100),
        new BigDecimal("0.001"),
        new BigDecimal("0.005"),
        Duration.ofSeconds(1),
        DEFAULT_RATE_LIMITS);
  }

  public MockConfig withLatency(Duration min, Duration max) {
    return new MockConfig(
        min,
        max,
        failureRates,
        seed,
        prices,
        balances,
        tickInterval,
        orderExecutionDelay,
        minSlippage,
        maxSlippage,
        retryDelay,
        rateLimits);
  }

  public MockConfig withFailureRates(MockFailureRates value) {
    return new MockConfig(
        minLatency,
        maxLatency,
        value,
        seed,
        prices,
        balances,
        tickInterval,
        orderExecutionDelay,
        minSlippage,
        maxSlippage,
        retryDelay,
        rateLimits);
  }

  public MockConfig withSeed(Long value) {
    return new MockConfig(
        minLatency,
        maxLatency,
        failureRates,
        value,
        prices,
        balances,
        tickInterval,
        orderExecutionDelay,
        minSlippage,
        maxSlippage,
        retryDelay,
        rateLimits);
  }

  public MockConfig withPrices(Map<String, BigDecimal> value) {
    return new MockConfig(
        minLatency,
        maxLatency,
        failureRates,
        seed,
        value,
        balances,
        tickInterval,
        orderExecutionDelay,
        minSlippage,
        maxSlippage,
        retryDelay,
        rateLimits);
  }

  public MockConfig withBalances(Map<String, BigDecimal> value) {
    return new MockConfig(
        minLatency,
        maxLatency,
        failureRates,
        seed,
        prices,
        value,
        tickInterval,
        orderExecutionDelay,
        minSlippage,
        maxSlippage,
        retryDelay,
        rateLimits);
  }

  public MockConfig withTiming(Duration tick, Duration executionDelay) {
    return new MockConfig(
        minLatency,
        maxLatency,
        failureRates,
        seed,
        prices,
        balances,
        tick,
        executionDelay,
        minSlippage,
        maxSlippage,
        retryDelay,
        rateLimits);
  }

  public MockConfig withSlippage(BigDecimal min, BigDecimal max) {
    return new MockConfig(
        minLatency,
        maxLatency,
        failureRates,
        seed,
        prices,
        balances,
        tickInterval,
        orderExecutionDelay,
        min,
        max,
        retryDelay,
        rateLimits);
  }

  public MockConfig withRetryDelay(Duration value) {
    return new MockConfig(
        minLatency,
        maxLatency,
        failureRates,
        seed,
        prices,
        balances,
        tickInterval,
        orderExecutionDelay,
        minSlippage,
        maxSlippage,
        value,
        rateLimits);
  }

  public MockConfig withRateLimits(RateLimitPolicy value) {
    return new MockConfig(
        minLatency,
        maxLatency,
        failureRates,
        seed,
        prices,
        balances,
        tickInterval,
        orderExecutionDelay,
        minSlippage,
        maxSlippage,
        retryDelay,
        value);
  }

  private static void requireNonNegative(Duration value, String name) {
    if (value == null || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be >= 0");
    }
  }

  @SafeVarargs
  private static Map<String, BigDecimal> orderedPrices(Map.Entry<String, BigDecimal>... entries) {
    Map<String, BigDecimal> ordered = new LinkedHashMap<>();
    for (Map.Entry<String, BigDecimal> entry : entries) {
      ordered.put(entry.getKey(), entry.getValue());
    }
    return Collections.unmodifiableMap(ordered);
  }

  private static Map<String, BigDecimal> canonicalPrices(Map<String, BigDecimal> source) {
    Map<String, BigDecimal> canonical = new LinkedHashMap<>();
    for (Map.Entry<String, BigDecimal> entry : source.entrySet()) {
      if (entry.getValue() == null || entry.getValue().signum() <= 0) {
        throw new IllegalArgumentException("price for " + entry.getKey() + " must be > 0");
      }
      canonical.put(CanonicalSymbol.parse(entry.getKey()).toString(), entry.getValue());
    }
    return Collections.unmodifiableMap(canonical);
  }

  private static Map<String, BigDecimal> upperCaseBalances(Map<String, BigDecimal> source) {
    Map<String, BigDecimal> normalized = new LinkedHashMap<>();
    for (Map.Entry<String, BigDecimal> entry : source.entrySet()) {
      if (entry.getValue() == null || entry.getValue().signum() < 0) {
        throw new IllegalArgumentException("balance for " + entry.getKey() + " must be >= 0");
      }
      normalized.put(entry.getKey().trim().toUpperCase(Locale.ROOT), entry.getValue());
    }
    return Collections.unmodifiableMap(normalized);
  }
}

package com.venuelink.integration.gemini;

import com.venuelink.adapter.core.ratelimit.RateLimitPolicy;
import com.venuelink.adapter.core.ratelimit.RateLimitQuota;
import com.venuelink.adapter.core.stream.StreamConfig;
import com.venuelink.domain.market.CanonicalSymbol;
import java.net.URI;
import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;

/**
 * Gemini endpoints and limits.
 *
 * @param symbols canonical symbols the adapter loads details for; empty loads every listed symbol
 */
public record GeminiConfig(
    URI restBaseUri,
    URI streamBaseUri,
    Duration reconnectBaseBackoff,
    Duration reconnectMaxBackoff,
    int bookDepth,
    Set<String> symbols,
    RateLimitPolicy rateLimits) {
  public static final URI PRODUCTION_REST = URI.create("https://api.gemini.com");
  public static final URI PRODUCTION_STREAM = URI.create("wss://api.gemini.com");
  public static final URI SANDBOX_REST = URI.create("https://api.sandbox.gemini.com");
  public static final URI SANDBOX_STREAM = URI.create("wss://api.sandbox.gemini.com");

  public static final RateLimitPolicy DEFAULT_RATE_LIMITS =
      new RateLimitPolicy(RateLimitQuota.perMinute(120), RateLimitQuota.perMinute(600));

  public GeminiConfig {
    if (restBaseUri == null) {
      throw new IllegalArgumentException("restBaseUri is required");
    }
    if (streamBaseUri == null) {
      throw new IllegalArgumentException("streamBaseUri is required");
    }
    if (reconnectBaseBackoff == null
        || reconnectBaseBackoff.isNegative()
        || reconnectBaseBackoff.isZero()) {
      throw new IllegalArgumentException("reconnectBaseBackoff must be > 0");
    }
    if (reconnectMaxBackoff == null || reconnectMaxBackoff.compareTo(reconnectBaseBackoff) < 0) {
      throw new IllegalArgumentException("reconnectMaxBackoff must be >= reconnectBaseBackoff");
    }
    if (bookDepth <= 0) {
      throw new IllegalArgumentException("bookDepth must be > 0");
    }
    Set<String> canonical = new TreeSet<>();
    if (symbols != null) {
      for (String symbol : symbols) {
        canonical.add(CanonicalSymbol.parse(symbol).toString());
      }
    }
    symbols = Set.copyOf(canonical);
    rateLimits = rateLimits == null ? DEFAULT_RATE_LIMITS : rateLimits;
  }

  public static GeminiConfig forEnvironment(boolean sandbox) {
    return new GeminiConfig(
        sandbox ? SANDBOX_REST : PRODUCTION_REST,
        sandbox ? SANDBOX_STREAM : PRODUCTION_STREAM,
        Duration.ofSeconds(1),
        Duration.ofSeconds(30),
        50,
        Set.of(),
        DEFAULT_RATE_LIMITS);
  }

  public GeminiConfig withEndpoints(URI rest, URI stream) {
    return new GeminiConfig(
        rest, stream, reconnectBaseBackoff, reconnectMaxBackoff, bookDepth, symbols, rateLimits);
  }

  public GeminiConfig withReconnectBackoff(Duration base, Duration max) {
    return new GeminiConfig(restBaseUri, streamBaseUri, base, max, bookDepth, symbols, rateLimits);
  }

  public GeminiConfig withSymbols(Set<String> value) {
    return new GeminiConfig(
        restBaseUri,
        streamBaseUri,
        reconnectBaseBackoff,
        reconnectMaxBackoff,
        bookDepth,
        value,
        rateLimits);
  }

  public GeminiConfig withRateLimits(RateLimitPolicy value) {
    return new GeminiConfig(
        restBaseUri,
        streamBaseUri,
        reconnectBaseBackoff,
        reconnectMaxBackoff,
        bookDepth,
        symbols,
        value);
  }

  StreamConfig marketStream() {
    return stream(GeminiPaths.MARKET_DATA);
  }

  StreamConfig orderStream() {
    return stream(GeminiPaths.ORDER_EVENTS);
  }

  private StreamConfig stream(String path) {
    String base = streamBaseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    URI uri = URI.create(base + path);
    return StreamConfig.of(uri).withReconnectBackoff(reconnectBaseBackoff, reconnectMaxBackoff);
  }
}

package com.venuelink.integration.cryptocom;

import com.venuelink.adapter.core.ratelimit.RateLimitPolicy;
import com.venuelink.adapter.core.ratelimit.RateLimitQuota;
import com.venuelink.adapter.core.stream.StreamConfig;
import java.net.URI;
import java.time.Duration;

public record CryptoComConfig(
    URI restBaseUri,
    URI marketStreamUri,
    URI userStreamUri,
    Duration streamOpenDelay,
    Duration reconnectBaseBackoff,
    Duration reconnectMaxBackoff,
    RateLimitPolicy rateLimits) {
  public static final URI PRODUCTION_REST = URI.create("https://api.crypto.com/v2");
  public static final URI PRODUCTION_MARKET_STREAM =
      URI.create("wss://stream.crypto.com/v2/market");
  public static final URI PRODUCTION_USER_STREAM = URI.create("wss://stream.crypto.com/v2/user");
  public static final URI SANDBOX_REST = URI.create("https://uat-api.3ona.co/v2");
  public static final URI SANDBOX_MARKET_STREAM = URI.create("wss://uat-stream.3ona.co/v2/market");
  public static final URI SANDBOX_USER_STREAM = URI.create("wss://uat-stream.3ona.co/v2/user");

  public static final RateLimitPolicy DEFAULT_RATE_LIMITS =
      new RateLimitPolicy(
          RateLimitQuota.perSecond(100), new RateLimitQuota(15, Duration.ofMillis(100)));

  public CryptoComConfig {
    if (restBaseUri == null) {
      throw new IllegalArgumentException("restBaseUri is required");
    }
    if (marketStreamUri == null) {
      throw new IllegalArgumentException("marketStreamUri is required");
    }
    if (userStreamUri == null) {
      throw new IllegalArgumentException("userStreamUri is required");
    }
    streamOpenDelay = streamOpenDelay == null ? Duration.ZERO : streamOpenDelay;
    if (streamOpenDelay.isNegative()) {
      throw new IllegalArgumentException("streamOpenDelay must be >= 0");
    }
    if (reconnectBaseBackoff == null
        || reconnectBaseBackoff.isNegative()
        || reconnectBaseBackoff.isZero()) {
      throw new IllegalArgumentException("reconnectBaseBackoff must be > 0");
    }
    if (reconnectMaxBackoff == null || reconnectMaxBackoff.compareTo(reconnectBaseBackoff) < 0) {
      throw new IllegalArgumentException("reconnectMaxBackoff must be >= reconnectBaseBackoff");
    }
    rateLimits = rateLimits == null ? DEFAULT_RATE_LIMITS : rateLimits;
  }

  /** Crypto.com rejects requests sent within the first second of a fresh socket. */
  public static CryptoComConfig forEnvironment(boolean sandbox) {
    return new CryptoComConfig(
        sandbox ? SANDBOX_REST : PRODUCTION_REST,
        sandbox ? SANDBOX_MARKET_STREAM : PRODUCTION_MARKET_STREAM,
        sandbox ? SANDBOX_USER_STREAM : PRODUCTION_USER_STREAM,
        Duration.ofSeconds(1),
        Duration.ofSeconds(1),
        Duration.ofSeconds(30),
        DEFAULT_RATE_LIMITS);
  }

  public CryptoComConfig withEndpoints(URI rest, URI marketStream, URI userStream) {
    return new CryptoComConfig(
        rest,
        marketStream,
        userStream,
        streamOpenDelay,
        reconnectBaseBackoff,
        reconnectMaxBackoff,
        rateLimits);
  }

  public CryptoComConfig withStreamTiming(Duration openDelay, Duration base, Duration max) {
    return new CryptoComConfig(
        restBaseUri, marketStreamUri, userStreamUri, openDelay, base, max, rateLimits);
  }

  public CryptoComConfig withRateLimits(RateLimitPolicy value) {
    return new CryptoComConfig(
        restBaseUri,
        marketStreamUri,
        userStreamUri,
        streamOpenDelay,
        reconnectBaseBackoff,
        reconnectMaxBackoff,
        value);
  }

  StreamConfig marketStream() {
    return streamConfig(marketStreamUri);
  }

  StreamConfig userStream() {
    return streamConfig(userStreamUri);
  }

  private StreamConfig streamConfig(URI uri) {
    return StreamConfig.of(uri)
        .withOpenDelay(streamOpenDelay)
        .withReconnectBackoff(reconnectBaseBackoff, reconnectMaxBackoff);
  }
}

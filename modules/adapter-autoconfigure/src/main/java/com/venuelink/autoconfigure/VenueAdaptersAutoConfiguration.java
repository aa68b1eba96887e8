package com.venuelink.autoconfigure;

import com.venuelink.adapter.core.AdapterSettings;
import com.venuelink.adapter.core.Credentials;
import com.venuelink.adapter.core.ratelimit.RateLimitPolicy;
import com.venuelink.adapter.core.ratelimit.RateLimitQuota;
import com.venuelink.adapter.core.telemetry.AdapterTelemetry;
import com.venuelink.adapter.core.telemetry.MicrometerAdapterTelemetry;
import com.venuelink.adapter.core.telemetry.NoOpAdapterTelemetry;
import com.venuelink.integration.cryptocom.CryptoComConfig;
import com.venuelink.integration.cryptocom.CryptoComExchangeAdapter;
import com.venuelink.integration.gemini.GeminiConfig;
import com.venuelink.integration.gemini.GeminiExchangeAdapter;
import com.venuelink.integration.mock.MockConfig;
import com.venuelink.integration.mock.MockExchangeAdapter;
import com.venuelink.integration.mock.MockFailureRates;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(VenueAdaptersProperties.class)
public class VenueAdaptersAutoConfiguration {
  private static final String PREFIX = "venue-adapters.";
  private static final List<String> API_CREDENTIALS = List.of("apiKey", "apiSecret");

  @Bean
  @ConditionalOnMissingBean(name = "venueAdaptersClock")
  public Clock venueAdaptersClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(AdapterTelemetry.class)
  public AdapterTelemetry micrometerAdapterTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerAdapterTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(AdapterTelemetry.class)
  public AdapterTelemetry noOpAdapterTelemetry() {
    return new NoOpAdapterTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public ExchangeAdapterRegistry exchangeAdapterRegistry(
      VenueAdaptersProperties properties, AdapterTelemetry telemetry, Clock venueAdaptersClock) {
    ExchangeAdapterRegistry registry = new ExchangeAdapterRegistry(venueAdaptersClock);

    VenueAdaptersProperties.Venue cryptocom = properties.getCryptocom();
    if (cryptocom.isEnabled()) {
      AdapterSettings settings = settings(cryptocom, "cryptocom", venueAdaptersClock);
      CryptoComConfig config =
          CryptoComConfig.forEnvironment(cryptocom.isSandbox())
              .withRateLimits(
                  rateLimits(cryptocom.getRateLimit(), CryptoComConfig.DEFAULT_RATE_LIMITS));
      registry.register(
          CryptoComExchangeAdapter.VENUE_ID,
          () -> new CryptoComExchangeAdapter(settings, config, telemetry),
          new VenueMetadata(
              CryptoComExchangeAdapter.VENUE_ID,
              "Crypto.com Exchange",
              "Crypto.com spot exchange over JSON-RPC REST and WebSocket",
              CryptoComExchangeAdapter.CAPABILITIES,
              API_CREDENTIALS,
              settings.sandbox(),
              settings.testMode()));
    }

    VenueAdaptersProperties.Venue gemini = properties.getGemini();
    if (gemini.isEnabled()) {
      AdapterSettings settings = settings(gemini, "gemini", venueAdaptersClock);
      GeminiConfig config =
          GeminiConfig.forEnvironment(gemini.isSandbox())
              .withRateLimits(rateLimits(gemini.getRateLimit(), GeminiConfig.DEFAULT_RATE_LIMITS));
      registry.register(
          GeminiExchangeAdapter.VENUE_ID,
          () -> new GeminiExchangeAdapter(settings, config, telemetry),
          new VenueMetadata(
              GeminiExchangeAdapter.VENUE_ID,
              "Gemini",
              "Gemini spot exchange with signed REST and order event streams",
              GeminiExchangeAdapter.CAPABILITIES,
              API_CREDENTIALS,
              settings.sandbox(),
              settings.testMode()));
    }

    VenueAdaptersProperties.Mock mock = properties.getMock();
    if (mock.isEnabled()) {
      AdapterSettings settings = settings(mock, "mock", venueAdaptersClock);
      MockConfig config = mockConfig(mock);
      registry.register(
          MockExchangeAdapter.VENUE_ID,
          () -> new MockExchangeAdapter(settings, config, telemetry),
          new VenueMetadata(
              MockExchangeAdapter.VENUE_ID,
              "Mock Exchange",
              "In-process simulator for paper trading and tests",
              MockExchangeAdapter.CAPABILITIES,
              List.of(),
              settings.sandbox(),
              settings.testMode()));
    }
    return registry;
  }

  private static AdapterSettings settings(
      VenueAdaptersProperties.Venue venue, String venueId, Clock clock) {
    String apiKey =
        resolveOptionalSecret(
            venue.getApiKey(), venue.getApiKeyFile(), PREFIX + venueId + ".api-key-file");
    String apiSecret =
        resolveOptionalSecret(
            venue.getApiSecret(), venue.getApiSecretFile(), PREFIX + venueId + ".api-secret-file");
    return new AdapterSettings(
        venue.isSandbox(),
        Duration.ofMillis(Math.max(1L, venue.getTimeoutMs())),
        venue.isTestMode(),
        new Credentials(apiKey, apiSecret),
        clock);
  }

  private static RateLimitPolicy rateLimits(
      VenueAdaptersProperties.RateLimit overrides, RateLimitPolicy defaults) {
    if (overrides == null) {
      return defaults;
    }
    RateLimitQuota publicQuota =
        overrides.getPublicLimit() > 0
            ? new RateLimitQuota(overrides.getPublicLimit(), overrides.getWindow())
            : defaults.publicQuota();
    RateLimitQuota privateQuota =
        overrides.getPrivateLimit() > 0
            ? new RateLimitQuota(overrides.getPrivateLimit(), overrides.getWindow())
            : defaults.privateQuota();
    return new RateLimitPolicy(publicQuota, privateQuota);
  }

  private static MockConfig mockConfig(VenueAdaptersProperties.Mock mock) {
    VenueAdaptersProperties.Failures failures = mock.getFailures();
    return MockConfig.defaults()
        .withLatency(
            Duration.ofMillis(mock.getMinLatencyMs()), Duration.ofMillis(mock.getMaxLatencyMs()))
        .withSeed(mock.getSeed())
        .withTiming(
            Duration.ofMillis(mock.getTickIntervalMs()),
            Duration.ofMillis(mock.getOrderExecutionDelayMs()))
        .withRetryDelay(Duration.ofMillis(mock.getRetryDelayMs()))
        .withFailureRates(
            new MockFailureRates(
                failures.getConnection(),
                failures.getAuthentication(),
                failures.getOrderPlacement(),
                failures.getRateLimit()))
        .withRateLimits(rateLimits(mock.getRateLimit(), MockConfig.DEFAULT_RATE_LIMITS));
  }

  private static String resolveOptionalSecret(String value, String filePath, String propertyName) {
    if (filePath == null || filePath.isBlank()) {
      return value;
    }
    try {
      String fromFile = Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
      return fromFile.isBlank() ? value : fromFile;
    } catch (IOException ex) {
      throw new IllegalArgumentException(propertyName + " cannot be read: " + filePath, ex);
    }
  }
}

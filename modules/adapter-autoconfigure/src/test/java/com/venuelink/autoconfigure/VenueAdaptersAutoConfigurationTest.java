package com.venuelink.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.venuelink.adapter.core.ConnectionState;
import com.venuelink.adapter.core.ExchangeAdapter;
import com.venuelink.adapter.core.error.AuthenticationException;
import com.venuelink.adapter.core.telemetry.AdapterTelemetry;
import com.venuelink.adapter.core.telemetry.MicrometerAdapterTelemetry;
import com.venuelink.adapter.core.telemetry.NoOpAdapterTelemetry;
import com.venuelink.integration.mock.MockConfig;
import com.venuelink.integration.mock.MockExchangeAdapter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class VenueAdaptersAutoConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(VenueAdaptersAutoConfiguration.class))
          .withPropertyValues(
              "venue-adapters.mock.min-latency-ms=0", "venue-adapters.mock.max-latency-ms=0");

  @TempDir Path secrets;

  @Test
  void shouldRegisterEveryVenueByDefault() {
    contextRunner.run(
        context -> {
          assertThat(context).hasSingleBean(ExchangeAdapterRegistry.class);
          assertThat(context.getBean(ExchangeAdapterRegistry.class).registeredVenues())
              .extracting(VenueMetadata::venueId)
              .containsExactly("cryptocom", "gemini", "mock");
        });
  }

  @Test
  void shouldSkipDisabledVenues() {
    contextRunner
        .withPropertyValues(
            "venue-adapters.gemini.enabled=false", "venue-adapters.cryptocom.enabled=false")
        .run(
            context -> {
              ExchangeAdapterRegistry registry = context.getBean(ExchangeAdapterRegistry.class);
              assertThat(registry.registeredVenues())
                  .extracting(VenueMetadata::venueId)
                  .containsExactly("mock");
              assertThatThrownBy(() -> registry.create("gemini"))
                  .isInstanceOf(IllegalArgumentException.class);
            });
  }

  @Test
  void shouldUseNoOpTelemetryWhenMeterRegistryIsMissing() {
    contextRunner.run(
        context ->
            assertThat(context.getBean(AdapterTelemetry.class))
                .isInstanceOf(NoOpAdapterTelemetry.class));
  }

  @Test
  void shouldUseMicrometerTelemetryWhenMeterRegistryIsPresent() {
    contextRunner
        .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
        .run(
            context ->
                assertThat(context.getBean(AdapterTelemetry.class))
                    .isInstanceOf(MicrometerAdapterTelemetry.class));
  }

  @Test
  void shouldApplyMockSimulationAndRateLimitSettings() {
    contextRunner
        .withPropertyValues(
            "venue-adapters.mock.seed=7",
            "venue-adapters.mock.tick-interval-ms=250",
            "venue-adapters.mock.order-execution-delay-ms=5",
            "venue-adapters.mock.failures.order-placement=0.25",
            "venue-adapters.mock.rate-limit.public-limit=5",
            "venue-adapters.mock.rate-limit.window=10s")
        .run(
            context -> {
              ExchangeAdapterRegistry registry = context.getBean(ExchangeAdapterRegistry.class);
              MockExchangeAdapter adapter =
                  (MockExchangeAdapter) registry.get(registry.create("mock"));
              MockConfig config = adapter.config();

              assertThat(config.seed()).isEqualTo(7L);
              assertThat(config.tickInterval()).isEqualTo(Duration.ofMillis(250));
              assertThat(config.orderExecutionDelay()).isEqualTo(Duration.ofMillis(5));
              assertThat(config.failureRates().orderPlacement()).isEqualTo(0.25d);
              assertThat(adapter.rateLimits().publicQuota().limit()).isEqualTo(5);
              assertThat(adapter.rateLimits().publicQuota().window())
                  .isEqualTo(Duration.ofSeconds(10));
              assertThat(adapter.rateLimits().privateQuota())
                  .isEqualTo(MockConfig.DEFAULT_RATE_LIMITS.privateQuota());
            });
  }

  @Test
  void shouldPreferFileSecretsOverInlineValues() throws Exception {
    Path key = Files.writeString(secrets.resolve("key"), "file-key\n", StandardCharsets.UTF_8);
    Path secret =
        Files.writeString(secrets.resolve("secret"), "file-secret", StandardCharsets.UTF_8);

    contextRunner
        .withPropertyValues(
            "venue-adapters.mock.api-key=",
            "venue-adapters.mock.api-secret=",
            "venue-adapters.mock.api-key-file=" + key,
            "venue-adapters.mock.api-secret-file=" + secret)
        .run(
            context -> {
              ExchangeAdapterRegistry registry = context.getBean(ExchangeAdapterRegistry.class);
              ExchangeAdapter adapter = registry.get(registry.create("mock"));
              adapter.connect();
              adapter.authenticate();

              assertThat(adapter.connectionState()).isEqualTo(ConnectionState.AUTHENTICATED);
            });
  }

  @Test
  void shouldLeaveAdapterUnauthenticatedWithoutCredentials() {
    contextRunner
        .withPropertyValues("venue-adapters.mock.api-key=", "venue-adapters.mock.api-secret=")
        .run(
            context -> {
              ExchangeAdapterRegistry registry = context.getBean(ExchangeAdapterRegistry.class);
              ExchangeAdapter adapter = registry.get(registry.create("mock"));
              adapter.connect();

              assertThatThrownBy(adapter::authenticate)
                  .isInstanceOf(AuthenticationException.class);
            });
  }

  @Test
  void shouldFailStartupWhenSecretFileIsUnreadable() {
    contextRunner
        .withPropertyValues(
            "venue-adapters.gemini.api-secret-file=" + secrets.resolve("missing").toString())
        .run(
            context ->
                assertThat(context)
                    .hasFailed()
                    .getFailure()
                    .hasRootCauseInstanceOf(NoSuchFileException.class)
                    .hasStackTraceContaining("venue-adapters.gemini.api-secret-file"));
  }

  @Test
  void shouldDisconnectInstancesWhenContextCloses() {
    contextRunner.run(
        context -> {
          ExchangeAdapterRegistry registry = context.getBean(ExchangeAdapterRegistry.class);
          ExchangeAdapter adapter = registry.get(registry.create("mock"));
          adapter.connect();
          assertThat(adapter.connectionState()).isEqualTo(ConnectionState.CONNECTED);

          context.close();

          assertThat(adapter.connectionState()).isEqualTo(ConnectionState.DISCONNECTED);
        });
  }
}

package com.venuelink.adapter.core.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class MicrometerAdapterTelemetryTest {
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final MicrometerAdapterTelemetry telemetry = new MicrometerAdapterTelemetry(registry);

  @Test
  void shouldCountRequestsByOutcome() {
    telemetry.onRequestSuccess("gemini", "get_ticker", 1_000_000L);
    telemetry.onRequestSuccess("gemini", "get_ticker", 2_000_000L);
    telemetry.onRequestFailure("gemini", "get_ticker", "rate_limit_error", 500_000L);

    assertEquals(
        2.0d,
        registry
            .get("venue.adapter.requests.total")
            .tags("venue", "gemini", "operation", "get_ticker", "outcome", "success")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("venue.adapter.requests.total")
            .tags("outcome", "failure", "error", "rate_limit_error")
            .counter()
            .count());
    assertEquals(3L, registry.get("venue.adapter.requests.duration").timer().count());
  }

  @Test
  void shouldTrackStreamStateAsGauge() {
    telemetry.onStreamStateChanged("cryptocom", "market", true);
    assertEquals(
        1.0d,
        registry
            .get("venue.adapter.ws.connection.state")
            .tags("venue", "cryptocom", "stream", "market")
            .gauge()
            .value());

    telemetry.onStreamStateChanged("cryptocom", "market", false);
    assertEquals(
        0.0d, registry.get("venue.adapter.ws.connection.state").gauge().value());
  }

  @Test
  void shouldCountRateLimitRejectionsAndStreamMessages() {
    telemetry.onRateLimited("mock", "public");
    telemetry.onStreamMessage("mock", "market", "market_update");
    telemetry.onStreamReconnectScheduled("mock", "market");

    assertEquals(
        1.0d,
        registry
            .get("venue.adapter.rate_limit.rejected")
            .tag("request_class", "public")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("venue.adapter.ws.messages.total")
            .tag("type", "market_update")
            .counter()
            .count());
    assertEquals(1.0d, registry.get("venue.adapter.ws.reconnect.total").counter().count());
  }
}

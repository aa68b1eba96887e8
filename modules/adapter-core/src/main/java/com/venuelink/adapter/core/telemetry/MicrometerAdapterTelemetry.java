package com.venuelink.adapter.core.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class MicrometerAdapterTelemetry implements AdapterTelemetry {
  private final MeterRegistry meterRegistry;
  private final Map<String, AtomicInteger> streamStates = new ConcurrentHashMap<>();

  public MicrometerAdapterTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  @Override
  public void onRequestSuccess(String venue, String operation, long durationNanos) {
    Counter.builder("venue.adapter.requests.total")
        .description("Total venue adapter requests by outcome")
        .tag("venue", safeValue(venue))
        .tag("operation", safeValue(operation))
        .tag("outcome", "success")
        .register(meterRegistry)
        .increment();
    recordDuration(venue, operation, durationNanos);
  }

  @Override
  public void onRequestFailure(
      String venue, String operation, String errorKind, long durationNanos) {
    Counter.builder("venue.adapter.requests.total")
        .description("Total venue adapter requests by outcome")
        .tag("venue", safeValue(venue))
        .tag("operation", safeValue(operation))
        .tag("outcome", "failure")
        .tag("error", safeValue(errorKind))
        .register(meterRegistry)
        .increment();
    recordDuration(venue, operation, durationNanos);
  }

  @Override
  public void onRateLimited(String venue, String requestClass) {
    Counter.builder("venue.adapter.rate_limit.rejected")
        .description("Requests rejected by the local sliding-window limiter")
        .tag("venue", safeValue(venue))
        .tag("request_class", safeValue(requestClass))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onStreamStateChanged(String venue, String stream, boolean connected) {
    String key = safeValue(venue) + "|" + safeValue(stream);
    AtomicInteger state =
        streamStates.computeIfAbsent(
            key,
            ignored ->
                meterRegistry.gauge(
                    "venue.adapter.ws.connection.state",
                    Tags.of("venue", safeValue(venue), "stream", safeValue(stream)),
                    new AtomicInteger(0)));
    state.set(connected ? 1 : 0);
  }

  @Override
  public void onStreamReconnectScheduled(String venue, String stream) {
    meterRegistry
        .counter(
            "venue.adapter.ws.reconnect.total",
            "venue",
            safeValue(venue),
            "stream",
            safeValue(stream))
        .increment();
  }

  @Override
  public void onStreamMessage(String venue, String stream, String messageType) {
    meterRegistry
        .counter(
            "venue.adapter.ws.messages.total",
            "venue",
            safeValue(venue),
            "stream",
            safeValue(stream),
            "type",
            safeValue(messageType))
        .increment();
  }

  private void recordDuration(String venue, String operation, long durationNanos) {
    Timer.builder("venue.adapter.requests.duration")
        .description("Venue adapter request latency")
        .tag("venue", safeValue(venue))
        .tag("operation", safeValue(operation))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }
}

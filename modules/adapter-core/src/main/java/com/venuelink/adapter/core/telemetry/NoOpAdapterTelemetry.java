package com.venuelink.adapter.core.telemetry;

public class NoOpAdapterTelemetry implements AdapterTelemetry {
  @Override
  public void onRequestSuccess(String venue, String operation, long durationNanos) {}

  @Override
  public void onRequestFailure(
      String venue, String operation, String errorKind, long durationNanos) {}

  @Override
  public void onRateLimited(String venue, String requestClass) {}

  @Override
  public void onStreamStateChanged(String venue, String stream, boolean connected) {}

  @Override
  public void onStreamReconnectScheduled(String venue, String stream) {}

  @Override
  public void onStreamMessage(String venue, String stream, String messageType) {}
}

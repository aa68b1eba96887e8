package com.venuelink.adapter.core.telemetry;

public interface AdapterTelemetry {
  void onRequestSuccess(String venue, String operation, long durationNanos);

  void onRequestFailure(String venue, String operation, String errorKind, long durationNanos);

  void onRateLimited(String venue, String requestClass);

  void onStreamStateChanged(String venue, String stream, boolean connected);

  void onStreamReconnectScheduled(String venue, String stream);

  void onStreamMessage(String venue, String stream, String messageType);
}

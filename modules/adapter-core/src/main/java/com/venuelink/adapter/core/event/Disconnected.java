package com.venuelink.adapter.core.event;

import java.time.Instant;

public record Disconnected(String venue, String stream, String reason, Instant occurredAt)
    implements AdapterEvent {
  @Override
  public EventKind kind() {
    return EventKind.DISCONNECTED;
  }
}

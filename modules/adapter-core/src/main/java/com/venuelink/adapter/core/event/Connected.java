package com.venuelink.adapter.core.event;

import java.time.Instant;

public record Connected(String venue, String stream, Instant occurredAt) implements AdapterEvent {
  @Override
  public EventKind kind() {
    return EventKind.CONNECTED;
  }
}

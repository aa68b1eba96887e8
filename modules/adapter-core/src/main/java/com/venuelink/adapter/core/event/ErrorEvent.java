package com.venuelink.adapter.core.event;

import com.venuelink.adapter.core.error.ErrorKind;
import java.time.Instant;

public record ErrorEvent(String venue, ErrorKind type, String message, Instant occurredAt)
    implements AdapterEvent {
  @Override
  public EventKind kind() {
    return EventKind.ERROR;
  }
}
